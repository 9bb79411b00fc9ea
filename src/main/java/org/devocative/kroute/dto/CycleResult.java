package org.devocative.kroute.dto;

import lombok.Value;

import java.util.List;

@Value
public class CycleResult {
	ECycleState state;
	int records;
	List<String> failedUpdates;
	String message;

	public boolean isFallback() {
		return state == ECycleState.Fallback;
	}
}
