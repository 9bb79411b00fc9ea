package org.devocative.kroute.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder(toBuilder = true)
public class DnsRecord {
	String domain;
	String name;
	ERecordType type;

	@Singular
	Set<String> addresses;

	@Singular
	Set<String> servingNodes;

	Integer quotaPercent;
	String failoverTarget;

	public String toFQDN() {
		return String.format("%s.%s", name, domain);
	}

	public boolean hasFailover() {
		return failoverTarget != null;
	}
}
