package org.devocative.kroute.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.ClusterUnreachableException;
import org.devocative.kroute.ReconcileStageException;
import org.devocative.kroute.config.KrouteProperties;
import org.devocative.kroute.dto.*;
import org.devocative.kroute.iservice.IDnsBackend;
import org.devocative.kroute.iservice.IReconcileService;
import org.devocative.kroute.iservice.IStatusReporter;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.stream.Collectors;

import static org.devocative.kroute.dto.ECycleState.*;

@Slf4j
@RequiredArgsConstructor
@Service
public class ReconcileService implements IReconcileService {
	private static final DateTimeFormatter HEARTBEAT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm");

	private final SnapshotFetcher snapshotFetcher;
	private final RecordPlanner recordPlanner;
	private final QuotaEvaluator quotaEvaluator;
	private final FallbackCache fallbackCache;
	private final IDnsBackend dnsBackend;
	private final Optional<IStatusReporter> statusReporter;
	private final KrouteProperties properties;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	// ------------------------------

	@Override
	public CycleResult reconcile() {
		log.info("Reconcile: state=[{}]", Fetching);
		final ClusterSnapshot snapshot;
		try {
			snapshot = snapshotFetcher.fetch();
		} catch (ClusterUnreachableException e) {
			return fallback(e);
		} catch (RuntimeException e) {
			throw new ReconcileStageException(Fetching, e);
		}

		log.info("Reconcile: state=[{}]", Planning);
		final Map<String, List<DnsRecord>> recordsByDomain;
		final Map<DnsRecord, Boolean> aliveness = new IdentityHashMap<>();
		try {
			recordsByDomain = recordPlanner.plan(snapshot, properties.getLabelNames());
			recordsByDomain.values().forEach(records -> records.forEach(record ->
				aliveness.put(record, quotaEvaluator.isAlive(record, snapshot.getNodes()))));
		} catch (RuntimeException e) {
			throw new ReconcileStageException(Planning, e);
		}

		log.info("Reconcile: state=[{}] domains={}", Applying, recordsByDomain.keySet());
		final var failed = new ArrayList<String>();
		recordsByDomain.forEach((domain, records) -> {
			for (final var record : records) {
				applyRecord(record, aliveness.get(record), failed);
			}
			applyHeartbeat(domain, failed);
		});
		final var reconciled = new ReconciliationSnapshot(recordsByDomain, snapshot.getNodes());
		fallbackCache.put(reconciled);

		log.info("Reconcile: state=[{}]", Reporting);
		report(buildReport(reconciled, true));

		final var message = failed.isEmpty() ?
			String.format("DNS records updated: domains=[%s] records=[%s]", recordsByDomain.size(), aliveness.size()) :
			String.format("DNS records updated with %s failure(s): %s", failed.size(), failed);
		log.info("Reconcile: state=[{}] {}", Done, message);
		return new CycleResult(Done, aliveness.size(), List.copyOf(failed), message);
	}

	// ------------------------------

	StatusReport buildReport(ReconciliationSnapshot snapshot, boolean available) {
		final var records = snapshot.getRecordsByDomain()
			.values()
			.stream()
			.flatMap(Collection::stream)
			.map(r -> new StatusReport.RecordStatus(
				r.getDomain(),
				r.getName(),
				r.getType(),
				r.getAddresses(),
				r.getQuotaPercent(),
				r.getFailoverTarget(),
				quotaEvaluator.isAlive(r, snapshot.getNodes())))
			.collect(Collectors.toList());
		final var nodes = snapshot.getNodes()
			.stream()
			.map(n -> new StatusReport.NodeStatus(n.getName(), n.getAddress()))
			.collect(Collectors.toList());
		return new StatusReport(available, clock.instant().toString(), records, nodes);
	}

	private CycleResult fallback(ClusterUnreachableException e) {
		log.error("Reconcile: state=[{}] cause=[{}]", Fallback, e.getMessage());

		final var cached = fallbackCache.get();
		if (cached.isEmpty()) {
			log.warn("Reconcile: no previous snapshot to report");
		}
		report(buildReport(cached.orElse(ReconciliationSnapshot.EMPTY), false));

		return new CycleResult(Fallback, 0, Collections.emptyList(),
			"Cluster API unreachable, DNS left untouched: " + e.getMessage());
	}

	private void applyRecord(DnsRecord record, boolean alive, List<String> failed) {
		final var domain = record.getDomain();
		final var ttl = properties.getTtl();

		if (record.hasFailover()) {
			final var failoverValues = List.of(record.getFailoverTarget());
			update(domain, record.getName() + properties.getFailoverSuffix(), failoverValues, ttl, failed);
		}

		final Collection<String> values;
		if (alive) {
			values = record.getAddresses();
		} else if (record.hasFailover()) {
			log.warn("Record Not Alive, Failing Over: record=[{}] addresses={} quota=[{}] failover=[{}]",
				record.toFQDN(), record.getAddresses(), record.getQuotaPercent(), record.getFailoverTarget());
			values = List.of(record.getFailoverTarget());
		} else {
			log.warn("Record Not Alive, No Failover: record=[{}] addresses={} quota=[{}]",
				record.toFQDN(), record.getAddresses(), record.getQuotaPercent());
			values = Collections.emptyList();
		}
		update(domain, record.getName(), values, ttl, failed);
	}

	private void applyHeartbeat(String domain, List<String> failed) {
		final var stamp = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).format(HEARTBEAT_FORMAT);
		update(domain, properties.getHeartbeatName(), List.of(stamp), properties.getTtl(), failed);
	}

	private void update(String domain, String name, Collection<String> values, int ttl, List<String> failed) {
		final var type = ERecordType.infer(values);
		try {
			log.info("DNS Update: name=[{}.{}] type=[{}] values={} ttl=[{}]", name, domain, type, values, ttl);
			dnsBackend.updateRecord(domain, name, values, ttl, type);
		} catch (RuntimeException e) {
			log.warn("DNS Update Failed: name=[{}.{}] cause=[{}]", name, domain, e.getMessage(), e);
			failed.add(String.format("%s.%s", name, domain));
		}
	}

	private void report(StatusReport report) {
		if (statusReporter.isEmpty()) {
			log.debug("No Status Reporter Configured");
			return;
		}

		try {
			final var json = objectMapper.writeValueAsString(report);
			statusReporter.get().write(json);
			log.info("Status Reported: available=[{}] records=[{}]", report.isAvailable(), report.getRecords().size());
		} catch (JsonProcessingException | RuntimeException e) {
			log.error("Status Report Failed: {}", e.getMessage(), e);
		}
	}
}
