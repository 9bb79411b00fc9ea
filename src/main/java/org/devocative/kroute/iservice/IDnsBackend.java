package org.devocative.kroute.iservice;

import org.devocative.kroute.dto.ERecordType;

import java.util.Collection;

public interface IDnsBackend {
	void updateRecord(String domain, String name, Collection<String> values, int ttl, ERecordType type);
}
