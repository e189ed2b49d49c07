package com.example.recordstore.records;

@FunctionalInterface
public interface RecordEventLog {

	void append(RecordEvent event);

}
