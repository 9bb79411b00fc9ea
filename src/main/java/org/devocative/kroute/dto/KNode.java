package org.devocative.kroute.dto;

import lombok.Value;

@Value
public class KNode {
	String name;

	/**
	 * Publicly routable address, null when the node reports none
	 */
	String address;
}
