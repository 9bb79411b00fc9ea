package org.devocative.kroute.iservice;

import org.devocative.kroute.dto.CycleResult;

public interface IReconcileService {
	CycleResult reconcile();
}
