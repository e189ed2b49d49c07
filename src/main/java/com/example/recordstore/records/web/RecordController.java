package com.example.recordstore.records.web;

import com.example.recordstore.records.QueryMode;
import com.example.recordstore.records.QueryModeResolver;
import com.example.recordstore.records.RecordSequence;
import com.example.recordstore.records.RecordStore;
import com.example.recordstore.records.RecordStoreException;
import com.example.recordstore.records.StoreResult;
import com.example.recordstore.records.StoredRecord;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/records")
public class RecordController {

	private final Logger logger = LoggerFactory.getLogger(this.getClass());

	private final RecordStore recordStore;

	public RecordController(RecordStore recordStore) {
		this.recordStore = recordStore;
	}

	@PostMapping
	public ResponseEntity<StoredRecord> createRecord(@RequestBody(required = false) Map<String, Object> payload,
			UriComponentsBuilder uriBuilder) {
		StoreResult<StoredRecord> result = this.recordStore.create(payload);
		if (result instanceof StoreResult.Found<StoredRecord> found) {
			URI location = uriBuilder.path("/records/{id}").build(found.result().id());
			return ResponseEntity.created(location).body(found.result());
		}
		return RecordResponses.failure(result);
	}

	@GetMapping
	public ResponseEntity<List<StoredRecord>> listRecords(@RequestParam(required = false) String showDeleted,
			@RequestParam(required = false) String onlyDeleted) {
		QueryMode mode = QueryModeResolver.resolve(showDeleted, onlyDeleted);
		return RecordResponses.ok(this.recordStore.list(mode).map(RecordSequence::toList));
	}

	@GetMapping(path = "/{id}")
	public ResponseEntity<StoredRecord> getRecord(@PathVariable("id") String rawId,
			@RequestParam(required = false) String showDeleted) {
		OptionalLong id = RecordResponses.parseId(rawId);
		if (id.isEmpty()) {
			return RecordResponses.notFound(rawId);
		}
		return RecordResponses.ok(this.recordStore.get(id.getAsLong(), QueryModeResolver.resolve(showDeleted)));
	}

	@DeleteMapping(path = "/{id}")
	public ResponseEntity<Void> deleteRecord(@PathVariable("id") String rawId) {
		OptionalLong id = RecordResponses.parseId(rawId);
		if (id.isEmpty()) {
			return RecordResponses.notFound(rawId);
		}
		return RecordResponses.noContent(this.recordStore.softDelete(id.getAsLong()));
	}

	@PostMapping(path = "/{id}/restore")
	public ResponseEntity<StoredRecord> restoreRecord(@PathVariable("id") String rawId) {
		OptionalLong id = RecordResponses.parseId(rawId);
		if (id.isEmpty()) {
			return RecordResponses.notFound(rawId);
		}
		return RecordResponses.ok(this.recordStore.restore(id.getAsLong()));
	}

	@ExceptionHandler(RecordStoreException.class)
	public ProblemDetail handleRecordStoreException(RecordStoreException e) {
		logger.warn("Failed to read records", e);
		return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "Record storage is unavailable");
	}

}
