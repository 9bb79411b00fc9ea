package org.devocative.kroute;

import lombok.Getter;
import org.devocative.kroute.dto.ECycleState;

@Getter
public class ReconcileStageException extends KrouteException {
	private final ECycleState stage;

	public ReconcileStageException(ECycleState stage, Throwable cause) {
		super(cause, "Reconciliation Failed: stage=[%s] cause=[%s]", stage, cause.getMessage());
		this.stage = stage;
	}
}
