package com.example.recordstore.records;

import com.example.recordstore.TestcontainersConfiguration;
import org.springframework.context.annotation.Import;
import org.testcontainers.junit.jupiter.Testcontainers;

@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresRecordMapperTest extends RecordMapperTest {

}
