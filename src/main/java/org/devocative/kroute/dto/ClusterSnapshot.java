package org.devocative.kroute.dto;

import lombok.Value;

import java.util.List;

@Value
public class ClusterSnapshot {
	List<KService> services;
	List<KPod> pods;
	List<KNode> nodes;
}
