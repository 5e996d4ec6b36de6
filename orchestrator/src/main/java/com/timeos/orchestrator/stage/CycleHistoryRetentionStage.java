package com.timeos.orchestrator.stage;

import com.timeos.orchestrator.cycle.CycleRecordStore;
import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.pipeline.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Default maintenance handler: prunes cycle history older than the retention
 * period. Runs inside the daily maintenance window only.
 */
public class CycleHistoryRetentionStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(CycleHistoryRetentionStage.class);

    private final CycleRecordStore records;
    private final Duration         retention;
    private final Clock            clock;

    public CycleHistoryRetentionStage(CycleRecordStore records, Duration retention, Clock clock) {
        this.records   = records;
        this.retention = retention;
        this.clock     = clock;
    }

    @Override
    public String stageName() {
        return StageNames.MAINTENANCE;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        Instant cutoff  = clock.instant().minus(retention);
        long    deleted = records.deleteFinishedBefore(cutoff);
        log.info("Pruned {} cycle record(s) finished before {}", deleted, cutoff);
        return StageOutcome.success(deleted);
    }
}
