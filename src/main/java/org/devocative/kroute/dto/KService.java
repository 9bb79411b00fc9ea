package org.devocative.kroute.dto;

import lombok.Value;

import java.util.Map;

@Value
public class KService {
	String name;
	String namespace;
	Map<String, String> selector;
	Map<String, String> labels;

	public String getLabel(String key) {
		return labels != null ? labels.get(key) : null;
	}
}
