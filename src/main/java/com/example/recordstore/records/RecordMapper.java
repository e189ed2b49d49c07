package com.example.recordstore.records;

import am.ik.pagination.CursorPage;
import am.ik.pagination.CursorPageRequest;
import am.ik.pagination.CursorPageRequest.Navigation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class RecordMapper implements RecordPersistence {

	private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
	};

	private final JdbcClient jdbcClient;

	private final ObjectMapper objectMapper;

	private final RowMapper<StoredRecord> recordRowMapper;

	public RecordMapper(JdbcClient jdbcClient, ObjectMapper objectMapper) {
		this.jdbcClient = jdbcClient;
		this.objectMapper = objectMapper;
		this.recordRowMapper = (rs, rowNum) -> {
			try {
				return new StoredRecord(rs.getLong("record_id"),
						objectMapper.readValue(rs.getString("payload"), PAYLOAD_TYPE), rs.getBoolean("deleted"),
						rs.getObject("created_at", OffsetDateTime.class),
						rs.getObject("deleted_at", OffsetDateTime.class));
			}
			catch (JsonProcessingException e) {
				throw new UncheckedIOException(e);
			}
		};
	}

	@Override
	public StoredRecord insert(Map<String, Object> payload, OffsetDateTime createdAt) {
		KeyHolder keyHolder = new GeneratedKeyHolder();
		this.jdbcClient.sql("""
				INSERT INTO records (payload, deleted, created_at) VALUES (:payload, FALSE, :createdAt)
				""")
			.param("payload", this.writePayload(payload))
			.param("createdAt", createdAt)
			.update(keyHolder, "record_id");
		Long recordId = keyHolder.getKeyAs(Long.class);
		if (recordId == null) {
			throw new DataRetrievalFailureException("No record_id generated for inserted record");
		}
		return this.load(recordId)
			.orElseThrow(() -> new DataRetrievalFailureException("Inserted record not found: " + recordId));
	}

	@Override
	public Optional<StoredRecord> load(long id) {
		return this.jdbcClient.sql("""
				SELECT record_id, payload, deleted, created_at, deleted_at FROM records WHERE record_id = :recordId
				""").param("recordId", id).query(this.recordRowMapper).optional();
	}

	@Override
	public boolean save(StoredRecord record) {
		return this.jdbcClient.sql("""
				UPDATE records SET deleted = :deleted, deleted_at = :deletedAt WHERE record_id = :recordId
				""")
			.param("deleted", record.deleted())
			.param("deletedAt", record.deletedAt(), Types.TIMESTAMP_WITH_TIMEZONE)
			.param("recordId", record.id())
			.update() > 0;
	}

	@Override
	public CursorPage<StoredRecord, Long> scan(QueryMode mode, CursorPageRequest<Long> pageRequest) {
		Optional<Long> cursor = pageRequest.cursorOptional();
		int pageSizePlus1 = pageRequest.pageSize() + 1;
		Navigation navigation = pageRequest.navigation();
		String nextQuery = """
				SELECT record_id, payload, deleted, created_at, deleted_at FROM records
				WHERE record_id > :cursor AND %s
				ORDER BY record_id ASC
				LIMIT :limit
				""".formatted(visibilityClause(mode));
		String previousQuery = """
				WITH page AS (SELECT record_id, payload, deleted, created_at, deleted_at FROM records
				WHERE record_id < :cursor AND %s
				ORDER BY record_id DESC
				LIMIT :limit)
				SELECT * FROM page ORDER BY record_id ASC
				""".formatted(visibilityClause(mode));

		List<StoredRecord> contentPlus1 = this.jdbcClient.sql(navigation.isNext() ? nextQuery : previousQuery)
			.param("cursor", cursor.orElse(navigation.isNext() ? Long.MIN_VALUE : Long.MAX_VALUE))
			.param("limit", pageSizePlus1)
			.query(this.recordRowMapper)
			.list();

		boolean hasPrevious;
		boolean hasNext;
		List<StoredRecord> content;
		if (navigation.isNext()) {
			hasPrevious = cursor.isPresent();
			hasNext = contentPlus1.size() == pageSizePlus1;
			content = hasNext ? contentPlus1.subList(0, pageRequest.pageSize()) : contentPlus1;
		}
		else {
			hasPrevious = contentPlus1.size() == pageSizePlus1;
			hasNext = cursor.isPresent();
			content = hasPrevious ? contentPlus1.subList(1, pageSizePlus1) : contentPlus1;
		}
		return new CursorPage<>(content, pageRequest.pageSize(), StoredRecord::id, hasPrevious, hasNext);
	}

	@Override
	public boolean erase(long id) {
		return this.jdbcClient.sql("""
				DELETE FROM records WHERE record_id = :recordId
				""").param("recordId", id).update() > 0;
	}

	@Override
	public List<Long> findDeletedBefore(OffsetDateTime cutoff, int limit) {
		return this.jdbcClient.sql("""
				SELECT record_id FROM records
				WHERE deleted = TRUE AND deleted_at < :cutoff
				ORDER BY deleted_at, record_id
				LIMIT :limit
				""").param("cutoff", cutoff).param("limit", limit).query(Long.class).list();
	}

	// same rule as VisibilityPolicy
	static String visibilityClause(QueryMode mode) {
		return switch (mode == null ? QueryMode.ACTIVE_ONLY : mode) {
			case ACTIVE_ONLY -> "deleted = FALSE";
			case INCLUDE_DELETED -> "TRUE";
			case DELETED_ONLY -> "deleted = TRUE";
		};
	}

	private String writePayload(Map<String, Object> payload) {
		try {
			return this.objectMapper.writeValueAsString(payload == null ? Map.of() : payload);
		}
		catch (JsonProcessingException e) {
			throw new UncheckedIOException(e);
		}
	}

}
