package org.devocative.kroute.dto;

import lombok.Value;

@Value
public class LabelNames {
	String domain;
	String name;
	String failover;
	String quota;
}
