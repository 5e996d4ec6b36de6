package com.timeos.orchestrator.stage;

import com.timeos.orchestrator.cycle.CycleRecordStore;
import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.pipeline.StageContext;
import com.timeos.orchestrator.pipeline.StageHistory;
import com.timeos.orchestrator.testing.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CycleHistoryRetentionStageTest {

    @Mock CycleRecordStore records;
    @Mock StageHistory     history;

    @Test
    void execute_deletesCyclesOlderThanRetention() {
        MutableClock clock = MutableClock.at("2026-10-18T03:05:00Z");
        when(records.deleteFinishedBefore(Instant.parse("2026-09-18T03:05:00Z"))).thenReturn(42L);
        CycleHistoryRetentionStage stage = new CycleHistoryRetentionStage(records, Duration.ofDays(30), clock);

        StageOutcome outcome = stage.execute(
                new StageContext(CycleContext.topLevel("c-9", 9), StageNames.MAINTENANCE, Map.of(), history));

        assertThat(stage.stageName()).isEqualTo(StageNames.MAINTENANCE);
        assertThat(outcome.status()).isEqualTo(StageStatus.SUCCESS);
        assertThat(outcome.itemsProcessed()).isEqualTo(42);
    }
}
