package com.example.recordstore.records;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StoredRecord(long id, Map<String, Object> payload, boolean deleted, OffsetDateTime createdAt,
		OffsetDateTime deletedAt) {

	public StoredRecord {
		payload = (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
	}

	public StoredRecord markDeleted(OffsetDateTime now) {
		if (this.deleted) {
			return this;
		}
		return new StoredRecord(this.id, this.payload, true, this.createdAt, now);
	}

	public StoredRecord markRestored() {
		if (!this.deleted) {
			return this;
		}
		return new StoredRecord(this.id, this.payload, false, this.createdAt, null);
	}

	public boolean isVisibleIn(QueryMode mode) {
		return VisibilityPolicy.visible(this, mode);
	}
}
