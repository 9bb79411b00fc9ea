package org.devocative.kroute.service;

import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.ClusterUnreachableException;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.config.KrouteProperties;
import org.devocative.kroute.dto.ClusterSnapshot;
import org.devocative.kroute.dto.KNode;
import org.devocative.kroute.dto.KPod;
import org.devocative.kroute.dto.KService;
import org.devocative.kroute.iservice.IClusterService;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
public class SnapshotFetcher {
	private final IClusterService clusterService;
	private final KrouteProperties properties;
	private final ExecutorService executor;
	private final AtomicInteger threadCounter = new AtomicInteger();

	public SnapshotFetcher(IClusterService clusterService, KrouteProperties properties) {
		this.clusterService = clusterService;
		this.properties = properties;
		this.executor = Executors.newFixedThreadPool(
			Math.max(2, properties.getNamespaces().size() * 2 + 1),
			r -> {
				final var thread = new Thread(r, "kroute-fetch-" + threadCounter.incrementAndGet());
				thread.setDaemon(true);
				return thread;
			});
	}

	// ------------------------------

	public ClusterSnapshot fetch() {
		final var namespaces = properties.getNamespaces();
		log.info("Fetching Cluster Snapshot: namespaces={}", namespaces);

		final var nodesFuture = CompletableFuture.supplyAsync(clusterService::listNodes, executor);
		final var servicesFutures = new ArrayList<CompletableFuture<List<KService>>>();
		final var podsFutures = new ArrayList<CompletableFuture<List<KPod>>>();
		for (final var namespace : namespaces) {
			servicesFutures.add(CompletableFuture.supplyAsync(() -> clusterService.listServices(namespace), executor));
			podsFutures.add(CompletableFuture.supplyAsync(() -> clusterService.listPods(namespace), executor));
		}

		final var all = new ArrayList<CompletableFuture<?>>();
		all.add(nodesFuture);
		all.addAll(servicesFutures);
		all.addAll(podsFutures);

		try {
			CompletableFuture
				.allOf(all.toArray(new CompletableFuture[0]))
				.get(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
		} catch (ExecutionException e) {
			final var cause = e.getCause();
			if (cause instanceof KrouteException) {
				throw (KrouteException) cause;
			}
			throw new KrouteException(cause, "Snapshot Fetch Failed: %s", cause.getMessage());
		} catch (TimeoutException e) {
			// cancel does not interrupt a running call, its thread is freed by the client read timeout (kroute.timeout)
			all.forEach(f -> f.cancel(true));
			throw new ClusterUnreachableException(e, "Snapshot Fetch Timed Out: timeout=[%s]", properties.getTimeout());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ClusterUnreachableException(e, "Snapshot Fetch Interrupted");
		}

		final var services = new ArrayList<KService>();
		servicesFutures.forEach(f -> services.addAll(f.join()));
		final var pods = new ArrayList<KPod>();
		podsFutures.forEach(f -> pods.addAll(f.join()));
		final List<KNode> nodes = nodesFuture.join();

		log.info("Cluster Snapshot: services=[{}] pods=[{}] nodes=[{}]", services.size(), pods.size(), nodes.size());
		return new ClusterSnapshot(services, pods, nodes);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}
}
