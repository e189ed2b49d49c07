package com.example.recordstore.records;

import am.ik.pagination.CursorPage;
import am.ik.pagination.CursorPageRequest;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface RecordPersistence {

	StoredRecord insert(Map<String, Object> payload, OffsetDateTime createdAt);

	Optional<StoredRecord> load(long id);

	/**
	 * @return {@code false} if no record with the id exists
	 */
	boolean save(StoredRecord record);

	/**
	 * Records visible under {@code mode}, ascending by id. The cursor is the id of the last
	 * record of the previous page, or absent for the first page.
	 */
	CursorPage<StoredRecord, Long> scan(QueryMode mode, CursorPageRequest<Long> pageRequest);

	boolean erase(long id);

	List<Long> findDeletedBefore(OffsetDateTime cutoff, int limit);

}
