package org.devocative.kroute.dto;

import java.util.Collection;
import java.util.regex.Pattern;

public enum ERecordType {
	A, CNAME;

	private static final Pattern IPV4 = Pattern.compile("^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

	// ------------------------------

	public static ERecordType infer(Collection<String> values) {
		for (String value : values) {
			if (!isAddress(value)) {
				return CNAME;
			}
		}
		return A;
	}

	public static boolean isAddress(String value) {
		return value != null && IPV4.matcher(value).matches();
	}
}
