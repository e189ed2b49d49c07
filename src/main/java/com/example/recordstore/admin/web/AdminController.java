package com.example.recordstore.admin.web;

import com.example.recordstore.records.RecordStore;
import com.example.recordstore.records.StoreResult;
import com.example.recordstore.records.StoredRecord;
import com.example.recordstore.records.web.RecordResponses;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {

	private final Logger logger = LoggerFactory.getLogger(this.getClass());

	private final RecordStore recordStore;

	public AdminController(RecordStore recordStore) {
		this.recordStore = recordStore;
	}

	@DeleteMapping(path = "/records/{id}")
	public ResponseEntity<Void> hardDeleteRecord(@PathVariable("id") String rawId) {
		OptionalLong id = RecordResponses.parseId(rawId);
		if (id.isEmpty()) {
			return RecordResponses.notFound(rawId);
		}
		StoreResult<StoredRecord> result = this.recordStore.hardDelete(id.getAsLong());
		if (result.isFound()) {
			logger.info("Record {} erased on admin request", id.getAsLong());
		}
		return RecordResponses.noContent(result);
	}

}
