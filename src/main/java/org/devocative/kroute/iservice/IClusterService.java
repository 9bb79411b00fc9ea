package org.devocative.kroute.iservice;

import org.devocative.kroute.dto.KNode;
import org.devocative.kroute.dto.KPod;
import org.devocative.kroute.dto.KService;

import java.util.List;

public interface IClusterService {
	List<KService> listServices(String namespace);

	List<KPod> listPods(String namespace);

	List<KNode> listNodes();
}
