package com.example.recordstore.records;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

@Component
public class DeletedRecordHouseKeeper implements SchedulingConfigurer {

	private final RecordStore recordStore;

	private final RecordStoreProps props;

	private final Clock clock;

	private final Logger logger = LoggerFactory.getLogger(this.getClass());

	public DeletedRecordHouseKeeper(RecordStore recordStore, RecordStoreProps props, Clock clock) {
		this.recordStore = recordStore;
		this.props = props;
		this.clock = clock;
	}

	@Override
	public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
		RecordStoreProps.Purge purge = this.props.purge();
		if (!purge.enabled()) {
			logger.info("Purging deleted records is disabled");
			return;
		}
		taskRegistrar.addCronTask(this::purgeDeletedRecords, purge.cron());
	}

	public void purgeDeletedRecords() {
		OffsetDateTime cutoff = OffsetDateTime.now(this.clock).minus(this.props.purge().retention());
		logger.info("Purging records deleted before {}", cutoff);
		StoreResult<List<Long>> result = this.recordStore.purgeDeletedBefore(cutoff);
		if (result instanceof StoreResult.Found<List<Long>> found) {
			logger.info("Purged {} records", found.result().size());
		}
		else {
			logger.warn("Purge skipped: {}", result);
		}
	}

}
