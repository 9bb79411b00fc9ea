package org.devocative.kroute.service.dns;

import org.devocative.kroute.KrouteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.model.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.devocative.kroute.dto.ERecordType.A;
import static org.devocative.kroute.dto.ERecordType.CNAME;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class TestRoute53DnsBackend {
	private Route53Client route53Client;

	@BeforeEach
	public void init() {
		route53Client = mock(Route53Client.class);
		when(route53Client.changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class)))
			.thenReturn(ChangeResourceRecordSetsResponse.builder()
				.changeInfo(ChangeInfo.builder().id("C1").status(ChangeStatus.PENDING).build())
				.build());
		when(route53Client.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
			.thenReturn(ListResourceRecordSetsResponse.builder().build());
	}

	@Test
	public void test_upsert_with_configured_zone() {
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		backend.updateRecord("example.com", "app", List.of("10.0.0.1", "10.0.0.2"), 60, A);

		final var captor = ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
		verify(route53Client).changeResourceRecordSets(captor.capture());
		verify(route53Client, never()).listHostedZonesByName(any(ListHostedZonesByNameRequest.class));

		final var request = captor.getValue();
		assertEquals("Z123", request.hostedZoneId());
		final var change = request.changeBatch().changes().get(0);
		assertEquals(ChangeAction.UPSERT, change.action());
		assertEquals("app.example.com.", change.resourceRecordSet().name());
		assertEquals(RRType.A, change.resourceRecordSet().type());
		assertEquals(60L, change.resourceRecordSet().ttl());
		assertEquals(List.of("10.0.0.1", "10.0.0.2"), change.resourceRecordSet().resourceRecords()
			.stream()
			.map(ResourceRecord::value)
			.collect(Collectors.toList()));
	}

	@Test
	public void test_zone_is_looked_up_once() {
		when(route53Client.listHostedZonesByName(any(ListHostedZonesByNameRequest.class)))
			.thenReturn(ListHostedZonesByNameResponse.builder()
				.hostedZones(HostedZone.builder().id("/hostedzone/Z9").name("example.com.").build())
				.build());
		final var backend = new Route53DnsBackend(route53Client, Map.of());

		backend.updateRecord("example.com", "app", List.of("backup.example.net"), 60, CNAME);
		backend.updateRecord("example.com", "app-failover", List.of("backup.example.net"), 60, CNAME);

		verify(route53Client, times(1)).listHostedZonesByName(any(ListHostedZonesByNameRequest.class));
		final var captor = ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
		verify(route53Client, times(2)).changeResourceRecordSets(captor.capture());
		assertEquals("/hostedzone/Z9", captor.getValue().hostedZoneId());
		assertEquals(RRType.CNAME, captor.getValue().changeBatch().changes().get(0).resourceRecordSet().type());
	}

	@Test
	public void test_unknown_zone_fails() {
		when(route53Client.listHostedZonesByName(any(ListHostedZonesByNameRequest.class)))
			.thenReturn(ListHostedZonesByNameResponse.builder()
				.hostedZones(HostedZone.builder().id("/hostedzone/Z1").name("other.com.").build())
				.build());
		final var backend = new Route53DnsBackend(route53Client, Map.of());

		assertThrows(KrouteException.class, () -> backend.updateRecord("example.com", "app", List.of("10.0.0.1"), 60, A));
		verify(route53Client, never()).changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class));
	}

	@Test
	public void test_sdk_failure_is_wrapped() {
		when(route53Client.changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class)))
			.thenThrow(Route53Exception.builder().message("Throttled").build());
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		final var e = assertThrows(KrouteException.class,
			() -> backend.updateRecord("example.com", "app", List.of("10.0.0.1"), 60, A));
		assertTrue(e.getMessage().contains("app.example.com."));
	}

	@Test
	public void test_type_swap_deletes_conflicting_set_in_same_batch() {
		final var aSet = recordSet(RRType.A, "10.0.0.1", "10.0.0.2");
		final var cnameSet = recordSet(RRType.CNAME, "failover.example.net");
		when(route53Client.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
			.thenReturn(ListResourceRecordSetsResponse.builder().resourceRecordSets(aSet).build())
			.thenReturn(ListResourceRecordSetsResponse.builder().resourceRecordSets(cnameSet).build());
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		backend.updateRecord("example.com", "app", List.of("failover.example.net"), 60, CNAME);
		backend.updateRecord("example.com", "app", List.of("10.0.0.1", "10.0.0.2"), 60, A);

		final var captor = ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
		verify(route53Client, times(2)).changeResourceRecordSets(captor.capture());

		final var toFailover = captor.getAllValues().get(0).changeBatch().changes();
		assertEquals(2, toFailover.size());
		assertEquals(ChangeAction.DELETE, toFailover.get(0).action());
		assertEquals(aSet, toFailover.get(0).resourceRecordSet());
		assertEquals(ChangeAction.UPSERT, toFailover.get(1).action());
		assertEquals(RRType.CNAME, toFailover.get(1).resourceRecordSet().type());

		final var backToLive = captor.getAllValues().get(1).changeBatch().changes();
		assertEquals(2, backToLive.size());
		assertEquals(ChangeAction.DELETE, backToLive.get(0).action());
		assertEquals(cnameSet, backToLive.get(0).resourceRecordSet());
		assertEquals(ChangeAction.UPSERT, backToLive.get(1).action());
		assertEquals(RRType.A, backToLive.get(1).resourceRecordSet().type());
	}

	@Test
	public void test_same_type_is_a_plain_upsert() {
		when(route53Client.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
			.thenReturn(ListResourceRecordSetsResponse.builder()
				.resourceRecordSets(recordSet(RRType.A, "10.0.0.1"))
				.build());
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		backend.updateRecord("example.com", "app", List.of("10.0.0.1", "10.0.0.2"), 60, A);

		final var captor = ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
		verify(route53Client).changeResourceRecordSets(captor.capture());
		final var changes = captor.getValue().changeBatch().changes();
		assertEquals(1, changes.size());
		assertEquals(ChangeAction.UPSERT, changes.get(0).action());
	}

	@Test
	public void test_empty_values_delete_bound_set() {
		final var aSet = recordSet(RRType.A, "10.0.0.1");
		when(route53Client.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
			.thenReturn(ListResourceRecordSetsResponse.builder()
				.resourceRecordSets(aSet, recordSet(RRType.TXT, "\"owner=kroute\""))
				.build());
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		backend.updateRecord("example.com", "app", List.of(), 60, A);

		final var captor = ArgumentCaptor.forClass(ChangeResourceRecordSetsRequest.class);
		verify(route53Client).changeResourceRecordSets(captor.capture());
		final var changes = captor.getValue().changeBatch().changes();
		assertEquals(1, changes.size());
		assertEquals(ChangeAction.DELETE, changes.get(0).action());
		assertEquals(aSet, changes.get(0).resourceRecordSet());
	}

	@Test
	public void test_empty_values_on_unbound_name_do_nothing() {
		when(route53Client.listResourceRecordSets(any(ListResourceRecordSetsRequest.class)))
			.thenReturn(ListResourceRecordSetsResponse.builder()
				.resourceRecordSets(ResourceRecordSet.builder()
					.name("zzz.example.com.")
					.type(RRType.A)
					.ttl(60L)
					.resourceRecords(ResourceRecord.builder().value("10.0.0.7").build())
					.build())
				.build());
		final var backend = new Route53DnsBackend(route53Client, Map.of("example.com", "Z123"));

		backend.updateRecord("example.com", "app", List.of(), 60, A);

		verify(route53Client, never()).changeResourceRecordSets(any(ChangeResourceRecordSetsRequest.class));
	}

	// ------------------------------

	private static ResourceRecordSet recordSet(RRType type, String... values) {
		return ResourceRecordSet.builder()
			.name("app.example.com.")
			.type(type)
			.ttl(60L)
			.resourceRecords(Stream.of(values)
				.map(value -> ResourceRecord.builder().value(value).build())
				.collect(Collectors.toList()))
			.build();
	}
}
