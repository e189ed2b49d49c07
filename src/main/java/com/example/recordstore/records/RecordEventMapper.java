package com.example.recordstore.records;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class RecordEventMapper implements RecordEventLog {

	private final JdbcClient jdbcClient;

	private final ObjectMapper objectMapper;

	public RecordEventMapper(JdbcClient jdbcClient, ObjectMapper objectMapper) {
		this.jdbcClient = jdbcClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public void append(RecordEvent event) {
		try {
			String snapshot = this.objectMapper.writeValueAsString(event.snapshot());
			this.jdbcClient
				.sql("""
						INSERT INTO record_events (record_id, event_type, record_snapshot, occurred_at) VALUES (:recordId, :eventType, :snapshot, :occurredAt)
						""")
				.param("recordId", event.recordId())
				.param("eventType", event.type().name())
				.param("snapshot", snapshot)
				.param("occurredAt", event.occurredAt())
				.update();
		}
		catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

}
