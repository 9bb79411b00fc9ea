package org.devocative.kroute.service;

import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.dto.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Component
public class RecordPlanner {

	public Map<String, List<DnsRecord>> plan(ClusterSnapshot snapshot, LabelNames labelNames) {
		final Map<String, String> nodeAddresses = snapshot.getNodes()
			.stream()
			.filter(node -> hasText(node.getAddress()))
			.collect(Collectors.toMap(KNode::getName, KNode::getAddress, (a, b) -> a));

		final var result = new LinkedHashMap<String, List<DnsRecord>>();
		for (final var service : snapshot.getServices()) {
			final var domain = service.getLabel(labelNames.getDomain());
			final var name = service.getLabel(labelNames.getName());
			if (!hasText(domain) || !hasText(name)) {
				continue;
			}

			final var record = buildRecord(service, domain.trim(), name.trim(), snapshot.getPods(), nodeAddresses, labelNames);
			log.debug("Planned Record: service=[{}/{}] record={}", service.getNamespace(), service.getName(), record);

			result.computeIfAbsent(record.getDomain(), k -> new ArrayList<>()).add(record);
		}
		return result;
	}

	// ------------------------------

	static boolean isSubset(Map<String, String> subset, Map<String, String> superset) {
		if (superset == null) {
			return false;
		}
		for (final var entry : subset.entrySet()) {
			if (!entry.getValue().equals(superset.get(entry.getKey()))) {
				return false;
			}
		}
		return true;
	}

	static Integer parseQuota(String value) {
		if (!hasText(value)) {
			return null;
		}
		try {
			final var quota = Integer.parseInt(value.trim());
			if (quota < 0 || quota > 100) {
				log.warn("Quota Out of Range, Ignored: value=[{}]", value);
				return null;
			}
			return quota;
		} catch (NumberFormatException e) {
			log.warn("Invalid Quota, Ignored: value=[{}]", value);
			return null;
		}
	}

	private DnsRecord buildRecord(KService service, String domain, String name, List<KPod> pods,
								  Map<String, String> nodeAddresses, LabelNames labelNames) {
		final var builder = DnsRecord.builder()
			.domain(domain)
			.name(name)
			.quotaPercent(parseQuota(service.getLabel(labelNames.getQuota())));

		final var failover = service.getLabel(labelNames.getFailover());
		if (hasText(failover)) {
			builder.failoverTarget(failover.trim());
		}

		final var selector = service.getSelector();
		if (selector != null && !selector.isEmpty()) {
			pods.stream()
				.filter(pod -> service.getNamespace().equals(pod.getNamespace()))
				.filter(pod -> isSubset(selector, pod.getLabels()))
				.filter(KPod::isReady)
				.map(KPod::getNodeName)
				.filter(Objects::nonNull)
				.filter(nodeAddresses::containsKey)
				.forEach(nodeName -> builder
					.servingNode(nodeName)
					.address(nodeAddresses.get(nodeName)));
		} else {
			log.warn("Service Without Selector: [{}/{}]", service.getNamespace(), service.getName());
		}

		final var record = builder.build();
		final Collection<String> typeSource = !record.getAddresses().isEmpty() || !record.hasFailover() ?
			record.getAddresses() :
			List.of(record.getFailoverTarget());
		return builder.type(ERecordType.infer(typeSource)).build();
	}

	private static boolean hasText(String value) {
		return value != null && !value.trim().isEmpty();
	}
}
