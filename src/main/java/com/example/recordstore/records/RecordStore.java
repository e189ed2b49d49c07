package com.example.recordstore.records;

import am.ik.pagination.CursorPage;
import am.ik.pagination.CursorPageRequest;
import am.ik.pagination.CursorPageRequest.Navigation;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

@Service
public class RecordStore {

	private final Logger logger = LoggerFactory.getLogger(this.getClass());

	private final RecordPersistence persistence;

	private final RecordEventLog eventLog;

	private final TransactionOperations transactionOperations;

	private final Clock clock;

	private final int pageSize;

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	public RecordStore(RecordPersistence persistence, RecordEventLog eventLog,
			TransactionOperations transactionOperations, Clock clock, RecordStoreProps props) {
		this.persistence = persistence;
		this.eventLog = eventLog;
		this.transactionOperations = transactionOperations;
		this.clock = clock;
		this.pageSize = props.pageSize();
	}

	public StoreResult<StoredRecord> create(Map<String, Object> payload) {
		return this.write("create", () -> {
			StoredRecord created = this.persistence.insert(payload == null ? Map.of() : payload,
					OffsetDateTime.now(this.clock));
			logger.debug("Created record {}", created.id());
			return StoreResult.found(created);
		});
	}

	public StoreResult<StoredRecord> get(long id, QueryMode mode) {
		return this.read("get", () -> this.persistence.load(id)
			.filter(record -> record.isVisibleIn(mode))
			.<StoreResult<StoredRecord>>map(StoreResult::found)
			.orElseGet(() -> StoreResult.notFound(id)));
	}

	public StoreResult<RecordSequence> list(QueryMode mode) {
		QueryMode effectiveMode = (mode == null) ? QueryMode.ACTIVE_ONLY : mode;
		CursorPageRequest<Long> firstPageRequest = new CursorPageRequest<>(null, this.pageSize, Navigation.NEXT);
		return this.read("list", () -> {
			CursorPage<StoredRecord, Long> firstPage = this.persistence.scan(effectiveMode, firstPageRequest);
			return StoreResult.found(new RecordSequence(firstPage, this.pageSize,
					pageRequest -> this.fetchPage(effectiveMode, pageRequest)));
		});
	}

	public StoreResult<StoredRecord> softDelete(long id) {
		OffsetDateTime now = OffsetDateTime.now(this.clock);
		return this.transition("softDelete", id, record -> record.markDeleted(now), RecordEvent.Type.SOFT_DELETED);
	}

	public StoreResult<StoredRecord> restore(long id) {
		return this.transition("restore", id, StoredRecord::markRestored, RecordEvent.Type.RESTORED);
	}

	/**
	 * Physically erases the record. Irreversible.
	 * @return the last state of the erased record
	 */
	public StoreResult<StoredRecord> hardDelete(long id) {
		return this.write("hardDelete", () -> {
			Optional<StoredRecord> current = this.persistence.load(id);
			if (current.isEmpty() || !this.erase(current.get())) {
				return StoreResult.notFound(id);
			}
			logger.info("Hard-deleted record {}", id);
			return StoreResult.found(current.get());
		});
	}

	public StoreResult<List<Long>> purgeDeletedBefore(OffsetDateTime cutoff) {
		return this.write("purge", () -> {
			List<Long> purged = new ArrayList<>();
			for (long id : this.persistence.findDeletedBefore(cutoff, this.pageSize)) {
				Optional<StoredRecord> current = this.persistence.load(id);
				if (current.isPresent() && current.get().deleted() && this.erase(current.get())) {
					purged.add(id);
				}
			}
			return StoreResult.found(purged);
		});
	}

	private StoreResult<StoredRecord> transition(String operation, long id, UnaryOperator<StoredRecord> change,
			RecordEvent.Type eventType) {
		return this.write(operation, () -> {
			Optional<StoredRecord> current = this.persistence.load(id);
			if (current.isEmpty()) {
				return StoreResult.notFound(id);
			}
			StoredRecord before = current.get();
			StoredRecord after = change.apply(before);
			if (after == before) {
				logger.debug("Record {} already in requested state, {} is a no-op", id, operation);
				return StoreResult.found(before);
			}
			if (!this.persistence.save(after)) {
				return StoreResult.notFound(id);
			}
			StoredRecord persisted = this.persistence.load(id)
				.orElseThrow(() -> new DataRetrievalFailureException("Record missing after " + operation + ": " + id));
			this.eventLog.append(new RecordEvent(id, eventType, persisted, OffsetDateTime.now(this.clock)));
			logger.info("Record {} {}", id, eventType);
			return StoreResult.found(persisted);
		});
	}

	private boolean erase(StoredRecord record) {
		if (!this.persistence.erase(record.id())) {
			return false;
		}
		this.eventLog.append(
				new RecordEvent(record.id(), RecordEvent.Type.HARD_DELETED, record, OffsetDateTime.now(this.clock)));
		return true;
	}

	private CursorPage<StoredRecord, Long> fetchPage(QueryMode mode, CursorPageRequest<Long> pageRequest) {
		StoreResult<CursorPage<StoredRecord, Long>> page = this.read("list",
				() -> StoreResult.found(this.persistence.scan(mode, pageRequest)));
		if (page instanceof StoreResult.StorageUnavailable<CursorPage<StoredRecord, Long>> unavailable) {
			throw new RecordStoreException(unavailable.message(), unavailable.cause());
		}
		return page.value().orElseThrow();
	}

	private <T> StoreResult<T> read(String operation, Supplier<StoreResult<T>> action) {
		return this.locked(this.lock.readLock(), operation, action);
	}

	private <T> StoreResult<T> write(String operation, Supplier<StoreResult<T>> action) {
		return this.locked(this.lock.writeLock(), operation, action);
	}

	private <T> StoreResult<T> locked(Lock lock, String operation, Supplier<StoreResult<T>> action) {
		lock.lock();
		try {
			StoreResult<T> result = this.transactionOperations.execute(status -> action.get());
			if (result == null) {
				throw new IllegalStateException("No result from " + operation);
			}
			return result;
		}
		catch (DataAccessException | TransactionException | UncheckedIOException e) {
			logger.warn("Storage failure during {}", operation, e);
			return StoreResult.storageUnavailable(operation + " failed: " + e.getMessage(), e);
		}
		finally {
			lock.unlock();
		}
	}

}
