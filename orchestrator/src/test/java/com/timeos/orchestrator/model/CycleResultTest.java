package com.timeos.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CycleResult and JobResult are plain value types: no Spring, no mocks.
 */
class CycleResultTest {

    static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    @Test
    void healthy_whenNothingFailed() {
        CycleResult cycle = CycleResult.start("c-1", 1, T0)
                .add(job("collect", StageStatus.SUCCESS))
                .add(job("truth", StageStatus.PARTIAL))
                .add(JobResult.skipped("maintenance", T0, "not scheduled this cycle", Map.of()))
                .finish(T0.plusSeconds(30));

        assertThat(cycle.isHealthy()).isTrue();
        assertThat(cycle.getSucceededJobs()).containsExactly("collect", "truth");
        assertThat(cycle.getSkippedJobs()).containsExactly("maintenance");
        assertThat(cycle.getDuration()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void unhealthy_whenAnyStageFailed() {
        CycleResult cycle = CycleResult.start("c-1", 1, T0)
                .add(job("collect", StageStatus.FAILED))
                .add(job("truth", StageStatus.SUCCESS))
                .finish(T0);

        assertThat(cycle.isHealthy()).isFalse();
        assertThat(cycle.getFailedJobs()).containsExactly("collect");
        assertThat(cycle.getPhase()).isEqualTo(CyclePhase.DEGRADED);
    }

    @Test
    void degradedInput_isFoundInNestedChildren() {
        JobResult staleChild = new JobResult("capacity", StageStatus.PARTIAL, T0, Duration.ZERO, null, 1,
                null, 1, false, Map.of("time", UpstreamState.STALE), List.of());
        JobResult truth = new JobResult("truth", StageStatus.PARTIAL, T0, Duration.ZERO, null, 1,
                null, 1, false, Map.of(), List.of(staleChild));

        CycleResult cycle = CycleResult.start("c-1", 1, T0).add(truth).finish(T0);

        assertThat(cycle.isHealthy()).isTrue();
        assertThat(cycle.isDegradedInput()).isTrue();
        assertThat(cycle.getPhase()).isEqualTo(CyclePhase.DEGRADED);
    }

    @Test
    void skippedStageWithStaleUpstream_isNotDegradedInput() {
        JobResult skipped = JobResult.skipped("snapshot", T0, "upstream not fresh: truth",
                Map.of("truth", UpstreamState.STALE));

        assertThat(skipped.ranOnDegradedInput()).isFalse();
    }

    @Test
    void finishedCycle_isFrozen() {
        CycleResult.Builder builder = CycleResult.start("c-1", 1, T0);
        builder.finish(T0);

        assertThatThrownBy(() -> builder.add(job("late", StageStatus.SUCCESS)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.finish(T0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finishBeforeStart_isClampedToStart() {
        CycleResult cycle = CycleResult.start("c-1", 1, T0).finish(T0.minusSeconds(5));

        assertThat(cycle.getFinishedAt()).isEqualTo(T0);
        assertThat(cycle.getDuration()).isZero();
    }

    @Test
    void sameOutcomeAs_ignoresTiming() {
        JobResult a = new JobResult("collect", StageStatus.SUCCESS, T0, Duration.ofSeconds(1),
                null, 5, null, 1, false, Map.of(), List.of());
        JobResult b = new JobResult("collect", StageStatus.SUCCESS, T0.plusSeconds(900), Duration.ofSeconds(7),
                null, 5, null, 1, false, Map.of(), List.of());
        JobResult c = new JobResult("collect", StageStatus.SUCCESS, T0, Duration.ofSeconds(1),
                null, 6, null, 1, false, Map.of(), List.of());

        assertThat(a.sameOutcomeAs(b)).isTrue();
        assertThat(a.sameOutcomeAs(c)).isFalse();
    }

    @Test
    void stageOutcome_failedRequiresAnError() {
        assertThatThrownBy(() -> new StageOutcome(StageStatus.FAILED, 0, " ", null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StageOutcome.success(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static JobResult job(String name, StageStatus status) {
        return new JobResult(name, status, T0, Duration.ofSeconds(1),
                status == StageStatus.FAILED ? "boom" : null, 0, null, 1, false, Map.of(), List.of());
    }
}
