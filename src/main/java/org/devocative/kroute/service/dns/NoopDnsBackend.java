package org.devocative.kroute.service.dns;

import lombok.extern.slf4j.Slf4j;
import org.devocative.kroute.dto.ERecordType;
import org.devocative.kroute.iservice.IDnsBackend;

import java.util.Collection;

@Slf4j
public class NoopDnsBackend implements IDnsBackend {
	@Override
	public void updateRecord(String domain, String name, Collection<String> values, int ttl, ERecordType type) {
		log.info("Noop Update: name=[{}.{}] type=[{}] values={} ttl=[{}]", name, domain, type, values, ttl);
	}
}
