package com.example.recordstore.records;

import java.util.Optional;
import java.util.function.Function;

public sealed interface StoreResult<T>
		permits StoreResult.Found, StoreResult.NotFound, StoreResult.StorageUnavailable {

	static <T> StoreResult<T> found(T value) {
		return new Found<>(value);
	}

	static <T> StoreResult<T> notFound(long id) {
		return new NotFound<>(id);
	}

	static <T> StoreResult<T> storageUnavailable(String message, Throwable cause) {
		return new StorageUnavailable<>(message, cause);
	}

	default Optional<T> value() {
		return (this instanceof Found<T> found) ? Optional.of(found.result()) : Optional.empty();
	}

	default boolean isFound() {
		return this instanceof Found;
	}

	default <R> StoreResult<R> map(Function<? super T, ? extends R> mapper) {
		if (this instanceof Found<T> found) {
			return new Found<>(mapper.apply(found.result()));
		}
		if (this instanceof NotFound<T> notFound) {
			return new NotFound<>(notFound.id());
		}
		StorageUnavailable<T> unavailable = (StorageUnavailable<T>) this;
		return new StorageUnavailable<>(unavailable.message(), unavailable.cause());
	}

	record Found<T>(T result) implements StoreResult<T> {
	}

	// unknown id, or hidden by the query mode
	record NotFound<T>(long id) implements StoreResult<T> {
	}

	record StorageUnavailable<T>(String message, Throwable cause) implements StoreResult<T> {
	}

}
