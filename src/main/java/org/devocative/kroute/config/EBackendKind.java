package org.devocative.kroute.config;

public enum EBackendKind {
	Route53, CoreDNS, Noop
}
