package org.devocative.kroute.service.dns;

import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.dto.ERecordType;
import org.devocative.kroute.iservice.IDnsBackend;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
public class Route53DnsBackend implements IDnsBackend {
	private final Route53Client route53Client;
	private final Map<String, String> hostedZoneIds = new ConcurrentHashMap<>();

	public Route53DnsBackend(Route53Client route53Client, Map<String, String> hostedZoneIds) {
		this.route53Client = route53Client;
		this.hostedZoneIds.putAll(hostedZoneIds);
	}

	// ------------------------------

	@Override
	public void updateRecord(String domain, String name, Collection<String> values, int ttl, ERecordType type) {
		final var fqdn = String.format("%s.%s.", name, domain);
		final var zoneId = hostedZoneIds.computeIfAbsent(domain, this::findHostedZoneId);
		final var rrType = RRType.fromValue(type.name());

		// A and CNAME can not live together on one name, so a type swap goes in one batch with the delete
		final var changes = new ArrayList<Change>();
		for (final var existing : findRecordSets(zoneId, fqdn)) {
			if (values.isEmpty() || existing.type() != rrType) {
				changes.add(Change.builder()
					.action(ChangeAction.DELETE)
					.resourceRecordSet(existing)
					.build());
			}
		}

		if (!values.isEmpty()) {
			final var recordSet = ResourceRecordSet.builder()
				.name(fqdn)
				.type(rrType)
				.ttl((long) ttl)
				.resourceRecords(values.stream()
					.map(value -> ResourceRecord.builder().value(value).build())
					.collect(Collectors.toList()))
				.build();
			changes.add(Change.builder()
				.action(ChangeAction.UPSERT)
				.resourceRecordSet(recordSet)
				.build());
		}

		if (changes.isEmpty()) {
			log.debug("Route53: nothing bound, nothing to do: name=[{}]", fqdn);
			return;
		}

		final var request = ChangeResourceRecordSetsRequest.builder()
			.hostedZoneId(zoneId)
			.changeBatch(ChangeBatch.builder()
				.comment("kroute")
				.changes(changes)
				.build())
			.build();

		try {
			final var response = route53Client.changeResourceRecordSets(request);
			log.info("Route53: name=[{}] type=[{}] changes={} change=[{}] status=[{}]",
				fqdn, type, changes.stream().map(Change::actionAsString).collect(Collectors.toList()),
				response.changeInfo().id(), response.changeInfo().statusAsString());
		} catch (SdkException e) {
			throw new KrouteException(e, "Route53 Update Failed: name=[%s] zone=[%s]", fqdn, zoneId);
		}
	}

	// ------------------------------

	String findHostedZoneId(String domain) {
		final var zoneName = domain.endsWith(".") ? domain : domain + ".";
		try {
			final var response = route53Client.listHostedZonesByName(ListHostedZonesByNameRequest.builder()
				.dnsName(zoneName)
				.maxItems("1")
				.build());

			return response.hostedZones()
				.stream()
				.filter(zone -> zoneName.equalsIgnoreCase(zone.name()))
				.map(HostedZone::id)
				.findFirst()
				.orElseThrow(() -> new KrouteException("Route53 Hosted Zone Not Found: domain=[%s]", domain));
		} catch (SdkException e) {
			throw new KrouteException(e, "Route53 Hosted Zone Lookup Failed: domain=[%s]", domain);
		}
	}

	List<ResourceRecordSet> findRecordSets(String zoneId, String fqdn) {
		try {
			final var response = route53Client.listResourceRecordSets(ListResourceRecordSetsRequest.builder()
				.hostedZoneId(zoneId)
				.startRecordName(fqdn)
				.maxItems("2")
				.build());

			return response.resourceRecordSets()
				.stream()
				.filter(set -> fqdn.equalsIgnoreCase(set.name()))
				.filter(set -> set.type() == RRType.A || set.type() == RRType.CNAME)
				.collect(Collectors.toList());
		} catch (SdkException e) {
			throw new KrouteException(e, "Route53 Record Lookup Failed: name=[%s] zone=[%s]", fqdn, zoneId);
		}
	}
}
