package org.devocative.kroute;

public class ClusterUnreachableException extends KrouteException {
	public ClusterUnreachableException(String message, Object... args) {
		super(message, args);
	}

	public ClusterUnreachableException(Throwable cause, String message, Object... args) {
		super(cause, message, args);
	}
}
