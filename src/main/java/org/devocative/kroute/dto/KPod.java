package org.devocative.kroute.dto;

import lombok.Value;

import java.util.Map;

@Value
public class KPod {
	String name;
	String namespace;
	Map<String, String> labels;

	/**
	 * Hosting node, null when the pod is not scheduled yet
	 */
	String nodeName;
	boolean ready;
}
