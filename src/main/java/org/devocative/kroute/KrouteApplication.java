package org.devocative.kroute;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.Configuration;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.Config;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.config.KrouteProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.FileReader;
import java.io.IOException;

@Slf4j
@SpringBootApplication
public class KrouteApplication {

	@Bean
	public CoreV1Api getCoreV1Api(KrouteProperties properties) {
		final var auth = properties.getAuth();
		log.info("Cluster Auth: kind=[{}]", auth.getKind());

		try {
			final ApiClient client = createApiClient(auth);
			final var timeoutMillis = (int) properties.getTimeout().toMillis();
			client.setConnectTimeout(timeoutMillis);
			client.setReadTimeout(timeoutMillis);
			client.setWriteTimeout(timeoutMillis);
			Configuration.setDefaultApiClient(client);

			return new CoreV1Api(client);
		} catch (IOException e) {
			throw new KrouteException(e, "Cluster Client Creation Failed: auth=[%s]", auth.getKind());
		}
	}

	// ------------------------------

	public static void main(String[] args) {
		SpringApplication.run(KrouteApplication.class, args);
	}

	// ------------------------------

	private static ApiClient createApiClient(KrouteProperties.AuthConfig auth) throws IOException {
		if (auth.getKind() == null) {
			throw new KrouteException("Cluster Auth Kind Not Set: kroute.auth.kind");
		}

		switch (auth.getKind()) {
			case InCluster:
				return ClientBuilder.cluster().build();

			case KubeConfig:
				if (auth.getKubeConfigPath() == null) {
					return ClientBuilder.defaultClient();
				}
				try (var reader = new FileReader(auth.getKubeConfigPath())) {
					return ClientBuilder.kubeconfig(KubeConfig.loadKubeConfig(reader)).build();
				}

			case Token:
				if (auth.getApiServer() == null || auth.getToken() == null) {
					throw new KrouteException("Token Auth Requires: kroute.auth.api-server and kroute.auth.token");
				}
				return Config.fromToken(auth.getApiServer(), auth.getToken(), auth.isVerifySsl());

			default:
				throw new KrouteException("Unsupported Auth Kind: %s", auth.getKind());
		}
	}
}
