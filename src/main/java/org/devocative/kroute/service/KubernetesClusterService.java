package org.devocative.kroute.service;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.ClusterUnreachableException;
import org.devocative.kroute.KrouteException;
import org.devocative.kroute.config.KrouteProperties;
import org.devocative.kroute.dto.KNode;
import org.devocative.kroute.dto.KPod;
import org.devocative.kroute.dto.KService;
import org.devocative.kroute.iservice.IClusterService;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
@Service
public class KubernetesClusterService implements IClusterService {
	private final CoreV1Api coreV1Api;
	private final KrouteProperties properties;

	// ------------------------------

	@Override
	public List<KService> listServices(String namespace) {
		try {
			final var list = coreV1Api.listNamespacedService(
				namespace,
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				timeoutSeconds(),
				false);
			log.debug("List Services: namespace=[{}] size=[{}]", namespace, list.getItems().size());

			return list.getItems()
				.stream()
				.map(this::toService)
				.collect(Collectors.toList());
		} catch (ApiException e) {
			throw translate(e, "services of " + namespace);
		}
	}

	@Override
	public List<KPod> listPods(String namespace) {
		try {
			final var list = coreV1Api.listNamespacedPod(
				namespace,
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				timeoutSeconds(),
				false);
			log.debug("List Pods: namespace=[{}] size=[{}]", namespace, list.getItems().size());

			return list.getItems()
				.stream()
				.map(this::toPod)
				.collect(Collectors.toList());
		} catch (ApiException e) {
			throw translate(e, "pods of " + namespace);
		}
	}

	@Override
	public List<KNode> listNodes() {
		try {
			final var list = coreV1Api.listNode(
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				null,
				timeoutSeconds(),
				false);
			log.debug("List Nodes: size=[{}]", list.getItems().size());

			return list.getItems()
				.stream()
				.map(this::toNode)
				.collect(Collectors.toList());
		} catch (ApiException e) {
			throw translate(e, "nodes");
		}
	}

	// ------------------------------

	static KrouteException translate(ApiException e, String what) {
		if (e.getCode() == 0 || e.getCause() instanceof IOException) {
			log.error("Cluster API Unreachable: listing [{}]", what, e);
			return new ClusterUnreachableException(e, "Cluster API Unreachable: listing [%s]", what);
		}
		log.error("Cluster API Error: listing [{}] code=[{}] body=[{}]", what, e.getCode(), e.getResponseBody());
		return new KrouteException(e, "Cluster API Error: listing [%s] code=[%s]", what, e.getCode());
	}

	private Integer timeoutSeconds() {
		return (int) Math.max(1, properties.getTimeout().toSeconds());
	}

	private KService toService(V1Service obj) {
		final var md = obj.getMetadata();
		final var spec = obj.getSpec();
		return new KService(
			md.getName(),
			md.getNamespace(),
			spec != null && spec.getSelector() != null ? spec.getSelector() : Collections.emptyMap(),
			md.getLabels() != null ? md.getLabels() : Collections.emptyMap());
	}

	private KPod toPod(V1Pod obj) {
		final var md = obj.getMetadata();
		final var nodeName = obj.getSpec() != null ? obj.getSpec().getNodeName() : null;
		return new KPod(
			md.getName(),
			md.getNamespace(),
			md.getLabels() != null ? md.getLabels() : Collections.emptyMap(),
			nodeName,
			isReady(obj.getStatus()));
	}

	private KNode toNode(V1Node obj) {
		final var addressType = properties.getNodeAddressType();
		final var status = obj.getStatus();
		final var address = status == null || status.getAddresses() == null ? null :
			status.getAddresses()
				.stream()
				.filter(a -> addressType.equals(a.getType()))
				.map(V1NodeAddress::getAddress)
				.filter(Objects::nonNull)
				.findFirst()
				.orElse(null);
		if (address == null) {
			log.warn("Node Without [{}] Address: [{}]", addressType, obj.getMetadata().getName());
		}
		return new KNode(obj.getMetadata().getName(), address);
	}

	private static boolean isReady(V1PodStatus status) {
		if (status == null || status.getConditions() == null) {
			return false;
		}
		return status.getConditions()
			.stream()
			.anyMatch(c -> "Ready".equals(c.getType()) && "True".equals(c.getStatus()));
	}
}
