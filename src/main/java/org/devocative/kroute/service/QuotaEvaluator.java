package org.devocative.kroute.service;

import org.devocative.kroute.dto.DnsRecord;
import org.devocative.kroute.dto.KNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class QuotaEvaluator {

	public boolean isAlive(DnsRecord record, List<KNode> nodes) {
		if (record.getAddresses().isEmpty()) {
			return false;
		}

		final var quota = record.getQuotaPercent();
		if (quota == null) {
			return true;
		}

		if (nodes.isEmpty()) {
			return false;
		}

		final var nodeNames = nodes.stream()
			.map(KNode::getName)
			.collect(Collectors.toSet());
		final var serving = record.getServingNodes()
			.stream()
			.filter(nodeNames::contains)
			.count();

		return serving * 100 >= (long) quota * nodeNames.size();
	}
}
