package org.devocative.kroute.config;

import io.kubernetes.client.openapi.apis.CoreV1Api;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.iservice.IDnsBackend;
import org.devocative.kroute.iservice.IStatusReporter;
import org.devocative.kroute.service.S3StatusReporter;
import org.devocative.kroute.service.dns.CoreDNSZoneBackend;
import org.devocative.kroute.service.dns.NoopDnsBackend;
import org.devocative.kroute.service.dns.Route53DnsBackend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Clock;

@Slf4j
@Configuration
public class KrouteConfig {

	@Bean
	public IDnsBackend dnsBackend(KrouteProperties properties, CoreV1Api coreV1Api) {
		final var backend = properties.getBackend();
		if (backend.getKind() == null) {
			throw new KrouteException("DNS Backend Kind Not Set: kroute.backend.kind");
		}

		log.info("DNS Backend: kind=[{}]", backend.getKind());
		switch (backend.getKind()) {
			case Route53:
				final var route53Client = Route53Client.builder()
					.region(Region.of(backend.getRoute53().getRegion()))
					.overrideConfiguration(timeouts(properties))
					.build();
				return new Route53DnsBackend(route53Client, backend.getRoute53().getHostedZoneIds());

			case CoreDNS:
				final var coredns = backend.getCoredns();
				if (isBlank(coredns.getConfigMap()) || isBlank(coredns.getConfigMapNamespace())) {
					throw new KrouteException("CoreDNS Backend Requires: kroute.backend.coredns.config-map and config-map-namespace");
				}
				return new CoreDNSZoneBackend(coreV1Api, coredns);

			case Noop:
				return new NoopDnsBackend();

			default:
				throw new KrouteException("Unsupported DNS Backend: %s", backend.getKind());
		}
	}

	@Bean
	@ConditionalOnExpression("!'${kroute.status.bucket:}'.isEmpty()")
	public IStatusReporter statusReporter(KrouteProperties properties) {
		final var status = properties.getStatus();
		log.info("Status Reporter: bucket=[{}] key=[{}]", status.getBucket(), status.getKey());

		final var s3Client = S3Client.builder()
			.region(Region.of(status.getRegion()))
			.overrideConfiguration(timeouts(properties))
			.build();
		return new S3StatusReporter(s3Client, status.getBucket(), status.getKey());
	}

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	// ------------------------------

	private static ClientOverrideConfiguration timeouts(KrouteProperties properties) {
		return ClientOverrideConfiguration.builder()
			.apiCallTimeout(properties.getTimeout())
			.build();
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
