package com.example.recordstore.records;

import java.time.OffsetDateTime;

public record RecordEvent(long recordId, Type type, StoredRecord snapshot, OffsetDateTime occurredAt) {

	public enum Type {

		SOFT_DELETED, RESTORED, HARD_DELETED

	}
}
