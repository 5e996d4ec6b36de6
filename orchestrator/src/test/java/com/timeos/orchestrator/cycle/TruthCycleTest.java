package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.health.CircuitBreaker;
import com.timeos.orchestrator.health.HealthLedger;
import com.timeos.orchestrator.health.HealthState;
import com.timeos.orchestrator.health.InMemoryHealthStateStore;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.model.UpstreamState;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.pipeline.JobRunner;
import com.timeos.orchestrator.pipeline.RetryPolicy;
import com.timeos.orchestrator.pipeline.StageContext;
import com.timeos.orchestrator.pipeline.StagePipeline;
import com.timeos.orchestrator.stage.StageRegistry;
import com.timeos.orchestrator.testing.MutableClock;
import com.timeos.orchestrator.testing.RecordingPause;
import com.timeos.orchestrator.testing.ScriptedStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.timeos.orchestrator.stage.StageNames.CAPACITY;
import static com.timeos.orchestrator.stage.StageNames.CLIENT_HEALTH;
import static com.timeos.orchestrator.stage.StageNames.COLLECT;
import static com.timeos.orchestrator.stage.StageNames.COMMITMENT;
import static com.timeos.orchestrator.stage.StageNames.TIME;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Composite status rules and degradation of the truth sub-pipeline.
 */
class TruthCycleTest {

    static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    // ------------------------------------------------------------------
    // compose
    // ------------------------------------------------------------------

    @Test
    void compose_allSucceeded_isSuccessWithSummedItems() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                child(TIME, StageStatus.SUCCESS, 10), child(COMMITMENT, StageStatus.SUCCESS, 5)));

        assertThat(outcome.status()).isEqualTo(StageStatus.SUCCESS);
        assertThat(outcome.itemsProcessed()).isEqualTo(15);
        assertThat(outcome.children()).hasSize(2);
    }

    @Test
    void compose_successWithASkippedChild_isPartial() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                child(TIME, StageStatus.SUCCESS, 10),
                child(COMMITMENT, StageStatus.SUCCESS, 5),
                child(CAPACITY, StageStatus.SUCCESS, 3),
                JobResult.skipped(CLIENT_HEALTH, T0, JobRunner.CIRCUIT_OPEN_REASON, Map.of())));

        assertThat(outcome.status()).isEqualTo(StageStatus.PARTIAL);
        assertThat(outcome.note()).isEqualTo("client-health=skipped");
        assertThat(outcome.itemsProcessed()).isEqualTo(18);
    }

    @Test
    void compose_onlyPartialAndFailed_isPartial() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                child(TIME, StageStatus.FAILED, 0),
                child(COMMITMENT, StageStatus.PARTIAL, 2)));

        assertThat(outcome.status()).isEqualTo(StageStatus.PARTIAL);
    }

    @Test
    void compose_nothingRan_isSkipped() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                JobResult.skipped(TIME, T0, "shutdown requested", Map.of()),
                JobResult.skipped(COMMITMENT, T0, "shutdown requested", Map.of())));

        assertThat(outcome.status()).isEqualTo(StageStatus.SKIPPED);
        assertThat(outcome.note()).isEqualTo("all truth stages skipped");
    }

    @Test
    void compose_everythingThatRanFailed_isFailed() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                child(TIME, StageStatus.FAILED, 0),
                child(COMMITMENT, StageStatus.FAILED, 0),
                JobResult.skipped(CAPACITY, T0, "no data: time never produced output", Map.of())));

        assertThat(outcome.status()).isEqualTo(StageStatus.FAILED);
        assertThat(outcome.error()).contains("time, commitment");
    }

    @Test
    void compose_mixed_isPartialNamingTheNonSuccessfulChildren() {
        StageOutcome outcome = TruthCycle.compose(List.of(
                child(TIME, StageStatus.FAILED, 0),
                child(COMMITMENT, StageStatus.SUCCESS, 5),
                JobResult.skipped(CAPACITY, T0, "no data", Map.of())));

        assertThat(outcome.status()).isEqualTo(StageStatus.PARTIAL);
        assertThat(outcome.itemsProcessed()).isEqualTo(5);
        assertThat(outcome.note()).isEqualTo("time=failed, capacity=skipped");
    }

    // ------------------------------------------------------------------
    // Running the sub-pipeline
    // ------------------------------------------------------------------

    ExecutorService workers;
    HealthLedger    ledger;
    ScriptedStage   time, commitment, capacity, clientHealth;
    TruthCycle      truth;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        MutableClock clock = MutableClock.at("2026-10-18T12:00:00Z");
        HealthState state = new HealthState();
        CircuitBreaker breaker = new CircuitBreaker(state);
        ledger = new HealthLedger(state, breaker, new InMemoryHealthStateStore(), true);
        JobRunner runner = new JobRunner(workers, RetryPolicy.standard(), breaker, new RecordingPause(), clock,
                new SimpleMeterRegistry(), Duration.ofSeconds(5));

        time         = ScriptedStage.succeeding(TIME, 10);
        commitment   = ScriptedStage.succeeding(COMMITMENT, 4);
        capacity     = ScriptedStage.succeeding(CAPACITY, 3);
        clientHealth = ScriptedStage.succeeding(CLIENT_HEALTH, 2);
        StageRegistry registry = new StageRegistry(List.of(time, commitment, capacity, clientHealth));

        truth = new TruthCycle(new StagePipeline("truth", TruthCycle.stageSpecs(registry, name -> null),
                runner, ledger, () -> false, clock));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void execute_allHealthy_childrenInOrder() throws Exception {
        StageOutcome outcome = truth.execute(outerContext(UpstreamState.FRESH));

        assertThat(outcome.status()).isEqualTo(StageStatus.SUCCESS);
        assertThat(outcome.itemsProcessed()).isEqualTo(19);
        assertThat(outcome.children()).extracting(JobResult::jobName)
                .containsExactly(TIME, COMMITMENT, CAPACITY, CLIENT_HEALTH);
    }

    @Test
    void execute_timeNeverProduced_dependentsSkippedAndCompositeIsPartial() throws Exception {
        time.willFail("calendar unreachable");

        StageOutcome outcome = truth.execute(outerContext(UpstreamState.FRESH));

        assertThat(outcome.status()).isEqualTo(StageStatus.PARTIAL);
        assertThat(outcome.children()).extracting(JobResult::status)
                .containsExactly(StageStatus.FAILED, StageStatus.SUCCESS, StageStatus.SKIPPED, StageStatus.SKIPPED);
        assertThat(outcome.children().get(2).note()).startsWith("no data");
        assertThat(capacity.calls()).isZero();
        assertThat(clientHealth.calls()).isZero();
    }

    @Test
    void execute_timeFailsAfterEarlierSuccess_dependentsRunOnLastKnownGood() throws Exception {
        truth.execute(outerContext(UpstreamState.FRESH));
        time.willFail("calendar unreachable");

        StageOutcome outcome = truth.execute(outerContext(UpstreamState.FRESH));

        assertThat(outcome.status()).isEqualTo(StageStatus.PARTIAL);
        assertThat(outcome.children()).extracting(JobResult::status)
                .containsExactly(StageStatus.FAILED, StageStatus.SUCCESS, StageStatus.PARTIAL, StageStatus.PARTIAL);
        assertThat(capacity.lastContext().upstream(TIME)).isEqualTo(UpstreamState.STALE);
    }

    @Test
    void execute_clientHealthCircuitOpen_compositeStaysPartial() throws Exception {
        clientHealth.willFail("scoring crashed");
        for (long c = 1; c <= 3; c++) {
            assertThat(truth.execute(outerContext(c)).status()).isEqualTo(StageStatus.PARTIAL);
        }

        StageOutcome fourth = truth.execute(outerContext(4));

        assertThat(fourth.status()).isEqualTo(StageStatus.PARTIAL);
        assertThat(fourth.children()).extracting(JobResult::status).containsExactly(
                StageStatus.SUCCESS, StageStatus.SUCCESS, StageStatus.SUCCESS, StageStatus.SKIPPED);
        assertThat(fourth.children().get(3).probe()).isTrue();
        assertThat(ledger.snapshot().circuitBrokenJobs()).containsExactly(CLIENT_HEALTH);
    }

    @Test
    void execute_innerStagesSeeTheOuterUpstream() throws Exception {
        truth.execute(outerContext(UpstreamState.STALE));

        assertThat(time.lastContext().enclosing()).containsEntry(COLLECT, UpstreamState.STALE);
        assertThat(time.lastContext().cycleId()).isEqualTo("cycle-1");
    }

    @Test
    void execute_innerStagesKeepTheirOwnHealth() throws Exception {
        commitment.willFail("crm timeout");

        truth.execute(outerContext(UpstreamState.FRESH));

        assertThat(ledger.snapshot().consecutiveFailures())
                .containsEntry(COMMITMENT, 1)
                .containsEntry(TIME, 0);
    }

    private StageContext outerContext(UpstreamState collect) {
        return new StageContext(CycleContext.topLevel("cycle-1", 1), "truth", Map.of(COLLECT, collect), ledger);
    }

    private StageContext outerContext(long cycleNumber) {
        return new StageContext(CycleContext.topLevel("cycle-" + cycleNumber, cycleNumber), "truth",
                Map.of(COLLECT, UpstreamState.FRESH), ledger);
    }

    private static JobResult child(String name, StageStatus status, long items) {
        return new JobResult(name, status, T0, Duration.ofSeconds(1),
                status == StageStatus.FAILED ? "boom" : null, items, null, 1, false, Map.of(), List.of());
    }
}
