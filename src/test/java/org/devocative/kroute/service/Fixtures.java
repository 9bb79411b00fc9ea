package org.devocative.kroute.service;

import org.devocative.kroute.dto.KNode;
import org.devocative.kroute.dto.KPod;
import org.devocative.kroute.dto.KService;
import org.devocative.kroute.dto.LabelNames;

import java.util.HashMap;
import java.util.Map;

final class Fixtures {
	static final LabelNames LABELS = new LabelNames("kroute/domain", "kroute/name", "kroute/failover", "kroute/quota");

	private Fixtures() {
	}

	static KService service(String name, String namespace, String domain, String recordName, Integer quota, String failover) {
		final var labels = new HashMap<String, String>();
		if (domain != null) {
			labels.put(LABELS.getDomain(), domain);
		}
		if (recordName != null) {
			labels.put(LABELS.getName(), recordName);
		}
		if (quota != null) {
			labels.put(LABELS.getQuota(), String.valueOf(quota));
		}
		if (failover != null) {
			labels.put(LABELS.getFailover(), failover);
		}
		return new KService(name, namespace, Map.of("app", name), labels);
	}

	static KPod pod(String name, String namespace, String app, String nodeName) {
		return new KPod(name, namespace, Map.of("app", app, "tier", "web"), nodeName, true);
	}

	static KNode node(String name, String address) {
		return new KNode(name, address);
	}
}
