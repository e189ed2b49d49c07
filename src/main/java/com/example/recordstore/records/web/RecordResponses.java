package com.example.recordstore.records.web;

import com.example.recordstore.records.StoreResult;
import java.util.OptionalLong;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

public final class RecordResponses {

	private RecordResponses() {
	}

	public static <T> ResponseEntity<T> ok(StoreResult<T> result) {
		if (result instanceof StoreResult.Found<T> found) {
			return ResponseEntity.ok(found.result());
		}
		return failure(result);
	}

	public static ResponseEntity<Void> noContent(StoreResult<?> result) {
		if (result.isFound()) {
			return ResponseEntity.noContent().build();
		}
		return failure(result);
	}

	public static <T> ResponseEntity<T> failure(StoreResult<?> result) {
		if (result instanceof StoreResult.NotFound<?> notFound) {
			return notFound(Long.toString(notFound.id()));
		}
		if (result instanceof StoreResult.StorageUnavailable<?>) {
			return ResponseEntity
				.of(ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "Record storage is unavailable"))
				.build();
		}
		throw new IllegalArgumentException("Not a failure: " + result);
	}

	public static <T> ResponseEntity<T> notFound(String rawId) {
		return ResponseEntity.of(ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, "Record not found: " + rawId))
			.build();
	}

	public static OptionalLong parseId(String rawId) {
		if (rawId == null) {
			return OptionalLong.empty();
		}
		try {
			return OptionalLong.of(Long.parseLong(rawId.strip()));
		}
		catch (NumberFormatException e) {
			return OptionalLong.empty();
		}
	}

}
