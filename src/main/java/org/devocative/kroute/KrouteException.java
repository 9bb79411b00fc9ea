package org.devocative.kroute;

public class KrouteException extends RuntimeException {
	public KrouteException(String message, Object... args) {
		this(null, message, args);
	}

	public KrouteException(Throwable cause) {
		this(cause, cause != null ? cause.getMessage() : null);
	}

	public KrouteException(Throwable cause, String message, Object... args) {
		super(format(message, args), cause);
	}

	// ------------------------------

	private static String format(String message, Object... args) {
		if (message != null && args != null && args.length > 0) {
			return String.format(message, args);
		}
		return message;
	}
}
