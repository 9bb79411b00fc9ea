package org.devocative.kroute.iservice;

public interface IStatusReporter {
	void write(String jsonDocument);
}
