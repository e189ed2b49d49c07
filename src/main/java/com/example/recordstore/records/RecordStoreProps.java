package com.example.recordstore.records;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "record-store")
public record RecordStoreProps(@DefaultValue("100") int pageSize, @DefaultValue Purge purge) {

	public RecordStoreProps {
		if (pageSize < 1) {
			throw new IllegalArgumentException("record-store.page-size must be positive: " + pageSize);
		}
	}

	public record Purge(@DefaultValue("true") boolean enabled, @DefaultValue("30d") Duration retention,
			@DefaultValue("0 0 * * * *") String cron) {
	}
}
