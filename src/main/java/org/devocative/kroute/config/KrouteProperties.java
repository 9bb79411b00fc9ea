package org.devocative.kroute.config;

import lombok.Getter;
import lombok.Setter;
import org.devocative.kroute.dto.LabelNames;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "kroute")
public class KrouteProperties {
	private List<String> namespaces = new ArrayList<>(List.of("default"));
	private int ttl = 60;
	private String heartbeatName = "kroute-liveness-check";
	private String failoverSuffix = "-failover";
	private String nodeAddressType = "ExternalIP";
	private Duration timeout = Duration.ofSeconds(10);
	private LabelConfig labels = new LabelConfig();
	private AuthConfig auth = new AuthConfig();
	private BackendConfig backend = new BackendConfig();
	private StatusConfig status = new StatusConfig();

	public LabelNames getLabelNames() {
		return new LabelNames(labels.getDomain(), labels.getName(), labels.getFailover(), labels.getQuota());
	}

	// ------------------------------

	@Getter
	@Setter
	public static class LabelConfig {
		private String domain = "kroute/domain";
		private String name = "kroute/name";
		private String failover = "kroute/failover";
		private String quota = "kroute/quota";
	}

	@Getter
	@Setter
	public static class AuthConfig {
		private EAuthKind kind = EAuthKind.InCluster;
		private String kubeConfigPath;
		private String apiServer;
		private String token;
		private boolean verifySsl = true;
	}

	@Getter
	@Setter
	public static class BackendConfig {
		private EBackendKind kind = EBackendKind.Noop;
		private Route53Config route53 = new Route53Config();
		private CoreDNSConfig coredns = new CoreDNSConfig();
	}

	@Getter
	@Setter
	public static class Route53Config {
		private String region = "aws-global";

		private Map<String, String> hostedZoneIds = new HashMap<>();
	}

	@Getter
	@Setter
	public static class CoreDNSConfig {
		private String configMap = "kroute-zones";
		private String configMapNamespace = "kube-system";
		private String keyPrefix = "db.";
	}

	@Getter
	@Setter
	public static class StatusConfig {
		private String bucket;
		private String key = "kroute/status.json";
		private String region = "us-east-1";
	}
}
