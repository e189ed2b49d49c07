package com.example.recordstore.records;

import java.util.Objects;

public final class VisibilityPolicy {

	private VisibilityPolicy() {
	}

	public static boolean visible(StoredRecord record, QueryMode mode) {
		Objects.requireNonNull(record, "record");
		return switch (mode == null ? QueryMode.ACTIVE_ONLY : mode) {
			case ACTIVE_ONLY -> !record.deleted();
			case INCLUDE_DELETED -> true;
			case DELETED_ONLY -> record.deleted();
		};
	}

}
