package com.timeos.orchestrator.observability;

import com.timeos.orchestrator.health.CircuitBreaker;
import com.timeos.orchestrator.health.HealthLedger;
import com.timeos.orchestrator.health.HealthState;
import com.timeos.orchestrator.health.InMemoryHealthStateStore;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.pipeline.CycleContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CycleLogWriterTest {

    static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    @Test
    void stuckCircuit_reportedOnceOpenLongEnough() {
        HealthState state = openCircuitAt("collect", 3);
        CycleLogWriter writer = new CycleLogWriter(10);

        assertThat(writer.stuckCircuits(state.snapshot(), 12)).isEmpty();
        assertThat(writer.stuckCircuits(state.snapshot(), 13))
                .singleElement()
                .asString()
                .contains("stage 'collect'")
                .contains("circuit-broken for 10 cycles")
                .contains("api down");
    }

    @Test
    void noOpenCircuits_noAlarms() {
        assertThat(new CycleLogWriter(1).stuckCircuits(new HealthState().snapshot(), 100)).isEmpty();
    }

    @Test
    void onCycleFinished_handlesNestedAndFailedJobs() {
        JobResult child = new JobResult("time", StageStatus.FAILED, T0, Duration.ofSeconds(1), "boom",
                0, null, 2, false, Map.of(), List.of());
        JobResult truth = new JobResult("truth", StageStatus.FAILED, T0, Duration.ofSeconds(1),
                "all truth stages failed: time", 0, null, 1, false, Map.of(), List.of(child));
        CycleResult cycle = CycleResult.start("c-13", 13, T0).add(truth).finish(T0.plusSeconds(2));

        assertThatCode(() -> new CycleLogWriter(10).onCycleFinished(cycle, openCircuitAt("collect", 3).snapshot()))
                .doesNotThrowAnyException();
    }

    private static HealthState openCircuitAt(String stage, long cycle) {
        HealthState state = new HealthState();
        HealthLedger ledger = new HealthLedger(state, new CircuitBreaker(state), new InMemoryHealthStateStore(), true);
        for (long c = cycle - 2; c <= cycle; c++) {
            ledger.record(CycleContext.topLevel("c-" + c, c), new JobResult(stage, StageStatus.FAILED, T0,
                    Duration.ofSeconds(1), "api down", 0, null, 2, false, Map.of(), List.of()));
        }
        return state;
    }
}
