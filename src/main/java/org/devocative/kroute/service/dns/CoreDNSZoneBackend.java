package org.devocative.kroute.service.dns;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.config.KrouteProperties;
import org.devocative.kroute.dto.ERecordType;
import org.devocative.kroute.iservice.IDnsBackend;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class CoreDNSZoneBackend implements IDnsBackend {
	private static final Pattern SOA_PATTERN = Pattern.compile("^(@\\s+\\d+\\s+IN\\s+SOA\\s+\\S+\\s+\\S+\\s+)(\\d+)(.*)$");

	private final CoreV1Api coreV1Api;
	private final KrouteProperties.CoreDNSConfig config;

	public CoreDNSZoneBackend(CoreV1Api coreV1Api, KrouteProperties.CoreDNSConfig config) {
		this.coreV1Api = coreV1Api;
		this.config = config;
	}

	// ------------------------------

	@Override
	public synchronized void updateRecord(String domain, String name, Collection<String> values, int ttl, ERecordType type) {
		final var configMap = readConfigMap();
		if (configMap.getData() == null) {
			configMap.setData(new HashMap<>());
		}

		final var key = config.getKeyPrefix() + domain;
		final var zone = configMap.getData().get(key);
		final var newZone = rewriteZone(zone, domain, name, values, ttl, type);

		if (newZone.isPresent()) {
			configMap.getData().put(key, newZone.get());
			replaceConfigMap(configMap);
			log.info("CoreDNS Zone Updated: key=[{}] name=[{}] values={}", key, name, values);
		} else {
			log.debug("CoreDNS Zone Unchanged: key=[{}] name=[{}]", key, name);
		}
	}

	// ------------------------------

	static Optional<String> rewriteZone(String zone, String domain, String name, Collection<String> values, int ttl, ERecordType type) {
		final List<String> lines = zone == null || zone.isBlank() ?
			new ArrayList<>(newZoneHeader(domain)) :
			Stream.of(zone.split("\\n")).collect(Collectors.toList());

		final var namePattern = Pattern.compile("^" + Pattern.quote(name) + "\\s+\\d+\\s+IN\\s+(A|CNAME)\\s+.*$");

		final var current = lines.stream()
			.filter(line -> namePattern.matcher(line.trim()).matches())
			.map(String::trim)
			.collect(Collectors.toList());
		final var wanted = values.stream()
			.map(value -> String.format("%s %s IN %s %s", name, ttl, type, toTarget(value, type)))
			.collect(Collectors.toList());

		if (new HashSet<>(current).equals(new HashSet<>(wanted))) {
			return Optional.empty();
		}

		final var newLines = lines.stream()
			.filter(line -> !namePattern.matcher(line.trim()).matches())
			.map(CoreDNSZoneBackend::bumpSerial)
			.collect(Collectors.toList());
		newLines.addAll(wanted);

		return Optional.of(String.join("\n", newLines));
	}

	// ------------------------------

	private static List<String> newZoneHeader(String domain) {
		return List.of(
			String.format("$ORIGIN %s.", domain),
			String.format("@ 3600 IN SOA ns.%s. hostmaster.%s. 0 7200 3600 1209600 60", domain, domain));
	}

	private static String bumpSerial(String line) {
		final Matcher matcher = SOA_PATTERN.matcher(line);
		if (matcher.matches()) {
			final var serial = Long.parseLong(matcher.group(2)) + 1;
			return matcher.group(1) + serial + matcher.group(3);
		}
		return line;
	}

	private static String toTarget(String value, ERecordType type) {
		if (type == ERecordType.CNAME && value.contains(".") && !value.endsWith(".")) {
			return value + ".";
		}
		return value;
	}

	private V1ConfigMap readConfigMap() {
		try {
			final var list = coreV1Api.listNamespacedConfigMap(
				config.getConfigMapNamespace(),
				null,
				null,
				null,
				"metadata.name=" + config.getConfigMap(),
				null,
				null,
				null,
				null,
				null,
				false);

			return list.getItems()
				.stream()
				.findFirst()
				.orElseThrow(() -> new KrouteException("Zone ConfigMap Not Found: name=[%s] namespace=[%s]",
					config.getConfigMap(), config.getConfigMapNamespace()));
		} catch (ApiException e) {
			log.error("readZoneConfigMap", e);
			throw new KrouteException(e, "Zone ConfigMap Read Failed: code=[%s]", e.getCode());
		}
	}

	private void replaceConfigMap(V1ConfigMap configMap) {
		try {
			coreV1Api.replaceNamespacedConfigMap(
				config.getConfigMap(),
				config.getConfigMapNamespace(),
				configMap,
				null,
				null,
				null);
		} catch (ApiException e) {
			log.error("replaceZoneConfigMap", e);
			throw new KrouteException(e, "Zone ConfigMap Replace Failed: code=[%s]", e.getCode());
		}
	}
}
