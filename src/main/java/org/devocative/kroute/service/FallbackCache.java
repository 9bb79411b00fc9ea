package org.devocative.kroute.service;

import org.devocative.kroute.dto.ReconciliationSnapshot;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class FallbackCache {
	private final Object lock = new Object();
	private ReconciliationSnapshot snapshot;

	public void put(ReconciliationSnapshot snapshot) {
		synchronized (lock) {
			this.snapshot = snapshot;
		}
	}

	public Optional<ReconciliationSnapshot> get() {
		synchronized (lock) {
			return Optional.ofNullable(snapshot);
		}
	}
}
