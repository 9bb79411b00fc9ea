package org.devocative.kroute.dto;

import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
public class StatusReport {
	boolean available;
	String timestamp;
	List<RecordStatus> records;
	List<NodeStatus> nodes;

	// ------------------------------

	@Value
	public static class RecordStatus {
		String domain;
		String name;
		ERecordType type;
		Set<String> addresses;
		Integer quotaPercent;
		String failoverTarget;
		boolean alive;
	}

	@Value
	public static class NodeStatus {
		String name;
		String address;
	}
}
