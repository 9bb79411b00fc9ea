package org.devocative.kroute.dto;

public enum ECycleState {
	Fetching, Planning, Applying, Reporting, Done, Fallback
}
