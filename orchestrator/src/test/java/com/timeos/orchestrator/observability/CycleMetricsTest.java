package com.timeos.orchestrator.observability;

import com.timeos.orchestrator.health.CircuitBreaker;
import com.timeos.orchestrator.health.HealthLedger;
import com.timeos.orchestrator.health.HealthState;
import com.timeos.orchestrator.health.InMemoryHealthStateStore;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CycleMetricsTest {

    static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    MutableClock        clock;
    SimpleMeterRegistry registry;
    CycleMetrics        metrics;
    HealthLedger        ledger;

    @BeforeEach
    void setUp() {
        clock    = new MutableClock(T0);
        registry = new SimpleMeterRegistry();
        metrics  = new CycleMetrics(clock);
        metrics.bindTo(registry);
        HealthState state = new HealthState();
        ledger = new HealthLedger(state, new CircuitBreaker(state), new InMemoryHealthStateStore(), true);
    }

    @Test
    void beforeFirstCycle_lastSuccessAgeIsNaN() {
        assertThat(registry.get("timeos.cycle.last_success_age_seconds").gauge().value()).isNaN();
        assertThat(registry.get("timeos.circuits.open").gauge().value()).isZero();
    }

    @Test
    void healthyCycle_countedAndAgeTracked() {
        CycleResult cycle = finish(1, job("collect", StageStatus.SUCCESS));
        metrics.onCycleFinished(cycle, ledger.snapshot());

        clock.advance(Duration.ofSeconds(90));

        assertThat(registry.get("timeos.cycles").tag("healthy", "true").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("timeos.cycle.duration").timer().count()).isEqualTo(1);
        assertThat(registry.get("timeos.cycle.last_success_age_seconds").gauge().value()).isEqualTo(90.0);
        assertThat(registry.get("timeos.stage.consecutive_failures").tag("stage", "collect").gauge().value())
                .isZero();
    }

    @Test
    void failingStage_reportsOpenCircuitAndFailureGauge() {
        for (long c = 1; c <= 3; c++) {
            metrics.onCycleFinished(finish(c, job("collect", StageStatus.FAILED)), ledger.snapshot());
        }

        assertThat(registry.get("timeos.cycles").tag("healthy", "false").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("timeos.circuits.open").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("timeos.stage.consecutive_failures").tag("stage", "collect").gauge().value())
                .isEqualTo(3.0);
        assertThat(registry.get("timeos.cycle.last_success_age_seconds").gauge().value()).isNaN();
    }

    private CycleResult finish(long number, JobResult job) {
        CycleContext context = CycleContext.topLevel("c-" + number, number);
        ledger.beginCycle();
        ledger.record(context, job);
        CycleResult cycle = CycleResult.start(context.cycleId(), number, clock.instant())
                .add(job)
                .finish(clock.instant());
        ledger.completeCycle(cycle);
        return cycle;
    }

    private static JobResult job(String name, StageStatus status) {
        return new JobResult(name, status, T0, Duration.ofSeconds(1),
                status == StageStatus.FAILED ? "boom" : null, 0, null, 1, false, Map.of(), List.of());
    }
}
