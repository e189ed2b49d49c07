package com.example.recordstore;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
		properties = { "spring.http.client.factory=simple" })
@ActiveProfiles("test")
class RecordStoreApplicationTests {

	RestClient restClient;

	@Autowired
	JdbcClient jdbcClient;

	@LocalServerPort
	int serverPort;

	@BeforeEach
	void setUp(@Autowired RestClient.Builder restClientBuilder) {
		this.restClient = restClientBuilder.baseUrl("http://localhost:" + serverPort)
			.defaultStatusHandler(__ -> true, (req, res) -> {
			})
			.build();
	}

	@AfterEach
	void tearDown() {
		this.jdbcClient.sql("DELETE FROM record_events").update();
		this.jdbcClient.sql("DELETE FROM records").update();
	}

	private ResponseEntity<JsonNode> createRecord(Map<String, Object> payload) {
		return this.restClient.post()
			.uri("/records")
			.contentType(MediaType.APPLICATION_JSON)
			.body(payload)
			.retrieve()
			.toEntity(JsonNode.class);
	}

	private ResponseEntity<JsonNode> get(String uri) {
		return this.restClient.get().uri(uri).retrieve().toEntity(JsonNode.class);
	}

	private HttpStatus delete(String uri) {
		return HttpStatus.valueOf(this.restClient.delete().uri(uri).retrieve().toBodilessEntity().getStatusCode().value());
	}

	@Test
	void createReturnsActiveRecordWithLocation() {
		ResponseEntity<JsonNode> response = createRecord(Map.of("name", "A"));
		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
		JsonNode body = response.getBody();
		assertThat(body).isNotNull();
		long id = body.get("id").asLong();
		assertThat(body.get("deleted").asBoolean()).isFalse();
		assertThat(body.get("payload").get("name").asText()).isEqualTo("A");
		URI location = response.getHeaders().getLocation();
		assertThat(location).isNotNull();
		assertThat(location.getPath()).isEqualTo("/records/" + id);

		ResponseEntity<JsonNode> fetched = get("/records/" + id);
		assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(fetched.getBody()).isEqualTo(body);
	}

	@Test
	void softDeleteRestoreScenario() {
		JsonNode created = createRecord(Map.of("name", "A")).getBody();
		assertThat(created).isNotNull();
		long id = created.get("id").asLong();

		assertThat(delete("/records/" + id)).isEqualTo(HttpStatus.NO_CONTENT);

		ResponseEntity<JsonNode> active = get("/records");
		assertThat(active.getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(active.getBody()).isEmpty();

		ResponseEntity<JsonNode> all = get("/records?showDeleted=true");
		assertThat(all.getBody()).hasSize(1);
		JsonNode deleted = all.getBody().get(0);
		assertThat(deleted.get("id").asLong()).isEqualTo(id);
		assertThat(deleted.get("deleted").asBoolean()).isTrue();
		assertThat(deleted.get("payload").get("name").asText()).isEqualTo("A");

		assertThat(get("/records/" + id).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(get("/records/" + id + "?showDeleted=TRUE").getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(get("/records?onlyDeleted=true").getBody()).hasSize(1);

		ResponseEntity<JsonNode> restored = this.restClient.post()
			.uri("/records/{id}/restore", id)
			.retrieve()
			.toEntity(JsonNode.class);
		assertThat(restored.getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(restored.getBody()).isEqualTo(created);

		ResponseEntity<JsonNode> afterRestore = get("/records?showDeleted=garbage");
		assertThat(afterRestore.getBody()).hasSize(1);
		assertThat(afterRestore.getBody().get(0)).isEqualTo(created);
		assertThat(get("/records?onlyDeleted=true").getBody()).isEmpty();
	}

	@Test
	void repeatedDeleteSucceeds() {
		JsonNode created = createRecord(Map.of("name", "A")).getBody();
		assertThat(created).isNotNull();
		long id = created.get("id").asLong();
		assertThat(delete("/records/" + id)).isEqualTo(HttpStatus.NO_CONTENT);
		assertThat(delete("/records/" + id)).isEqualTo(HttpStatus.NO_CONTENT);
		Integer events = this.jdbcClient.sql("SELECT COUNT(*) FROM record_events WHERE record_id = :recordId")
			.param("recordId", id)
			.query(Integer.class)
			.single();
		assertThat(events).isEqualTo(1);
	}

	@Test
	void unknownOrMalformedIdIsNotFound() {
		assertThat(delete("/records/999999")).isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(delete("/records/abc")).isEqualTo(HttpStatus.NOT_FOUND);
		ResponseEntity<JsonNode> response = get("/records/abc");
		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(response.getBody()).isNotNull();
		assertThat(response.getBody().get("detail").asText()).isEqualTo("Record not found: abc");
		assertThat(this.restClient.post()
			.uri("/records/999999/restore")
			.retrieve()
			.toBodilessEntity()
			.getStatusCode()
			.value()).isEqualTo(404);
	}

	@Test
	void listPagesThroughAllRecords() {
		for (int i = 0; i < 5; i++) {
			createRecord(Map.of("n", i));
		}
		JsonNode records = get("/records").getBody();
		assertThat(records).hasSize(5);
		for (int i = 0; i < 5; i++) {
			assertThat(records.get(i).get("payload").get("n").asInt()).isEqualTo(i);
		}
	}

	@Test
	void adminHardDeleteErasesRecord() {
		JsonNode created = createRecord(Map.of("name", "A")).getBody();
		assertThat(created).isNotNull();
		long id = created.get("id").asLong();
		assertThat(delete("/records/" + id)).isEqualTo(HttpStatus.NO_CONTENT);
		assertThat(delete("/admin/records/" + id)).isEqualTo(HttpStatus.NO_CONTENT);
		assertThat(get("/records/" + id + "?showDeleted=true").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
		assertThat(delete("/admin/records/" + id)).isEqualTo(HttpStatus.NOT_FOUND);
		Integer remaining = this.jdbcClient.sql("SELECT COUNT(*) FROM records WHERE record_id = :recordId")
			.param("recordId", id)
			.query(Integer.class)
			.single();
		assertThat(remaining).isZero();
	}

}
