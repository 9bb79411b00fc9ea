package org.devocative.kroute.dto;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class ReconciliationSnapshot {
	public static final ReconciliationSnapshot EMPTY = new ReconciliationSnapshot(Collections.emptyMap(), Collections.emptyList());

	Map<String, List<DnsRecord>> recordsByDomain;
	List<KNode> nodes;

	public ReconciliationSnapshot(Map<String, List<DnsRecord>> recordsByDomain, List<KNode> nodes) {
		final var copy = new LinkedHashMap<String, List<DnsRecord>>();
		recordsByDomain.forEach((domain, records) -> copy.put(domain, List.copyOf(records)));
		this.recordsByDomain = Collections.unmodifiableMap(copy);
		this.nodes = List.copyOf(nodes);
	}
}
