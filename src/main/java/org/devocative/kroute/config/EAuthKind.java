package org.devocative.kroute.config;

public enum EAuthKind {
	InCluster, KubeConfig, Token
}
