package org.devocative.kroute;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestKrouteException {

	@Test
	public void test_message_formatting() {
		assertEquals("Unsupported Auth Kind: Foo", new KrouteException("Unsupported Auth Kind: %s", "Foo").getMessage());
		assertEquals("100% plain", new KrouteException("100% plain").getMessage());

		final var cause = new IllegalStateException("boom");
		final var wrapped = new ClusterUnreachableException(cause, "Listing [%s]", "pods");
		assertEquals("Listing [pods]", wrapped.getMessage());
		assertSame(cause, wrapped.getCause());
		assertTrue(wrapped instanceof KrouteException);
	}
}
