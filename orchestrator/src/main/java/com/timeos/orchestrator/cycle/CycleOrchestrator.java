package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.health.HealthLedger;
import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.health.PersistenceMode;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.CyclePhase;
import com.timeos.orchestrator.model.DegradePolicy;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.pipeline.StagePipeline;
import com.timeos.orchestrator.pipeline.StageSchedule;
import com.timeos.orchestrator.pipeline.StageSpec;
import com.timeos.orchestrator.stage.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static com.timeos.orchestrator.stage.StageNames.COLLECT;
import static com.timeos.orchestrator.stage.StageNames.MAINTENANCE;
import static com.timeos.orchestrator.stage.StageNames.NOTIFY;
import static com.timeos.orchestrator.stage.StageNames.SNAPSHOT;
import static com.timeos.orchestrator.stage.StageNames.TRUTH;

/**
 * Drives cycles of the top-level pipeline:
 * collect → truth → snapshot → notify → maintenance.
 *
 * <p>Per cycle:
 * <ol>
 *   <li>Take the cycle lock; a cycle already in flight means this one is refused.</li>
 *   <li>Advance and persist the cycle counter, derive the cycle id.</li>
 *   <li>Run the pipeline; every stage outcome is persisted as it lands.</li>
 *   <li>Finalise the {@link CycleResult}, fold it into the health state,
 *       append it to the cycle history.</li>
 *   <li>Hand it to the {@link CycleObserver}s.</li>
 * </ol>
 *
 * Phase per cycle: IDLE → RUNNING → HEALTHY | DEGRADED → IDLE.
 *
 * <p>No stage outcome stops the orchestrator. Only
 * {@link OrchestratorBookkeepingException} escapes, and the run loop halts on it.
 */
public class CycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CycleOrchestrator.class);

    private static final DateTimeFormatter CYCLE_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final StagePipeline       pipeline;
    private final HealthLedger        ledger;
    private final CycleRecordStore    records;
    private final List<CycleObserver> observers;
    private final Clock               clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile CyclePhase phase     = CyclePhase.IDLE;
    private volatile CyclePhase lastPhase;

    public CycleOrchestrator(StagePipeline pipeline,
                             HealthLedger ledger,
                             CycleRecordStore records,
                             List<CycleObserver> observers,
                             Clock clock) {
        this.pipeline  = pipeline;
        this.ledger    = ledger;
        this.records   = records;
        this.observers = List.copyOf(observers);
        this.clock     = clock;
    }

    /**
     * The top-level stages.
     *
     * @param timeouts per-stage timeout, or null for the runner default
     */
    public static List<StageSpec> stageSpecs(StageRegistry registry,
                                             TruthCycle truth,
                                             StageSchedule maintenanceSchedule,
                                             Function<String, Duration> timeouts) {
        return List.of(
                StageSpec.named(COLLECT)
                        .runs(registry.resolve(COLLECT))
                        .timeout(timeouts.apply(COLLECT))
                        .build(),
                StageSpec.named(TRUTH)
                        .runs(truth)
                        .dependsOn(COLLECT)
                        .degrade(DegradePolicy.RUN_ON_STALE)
                        .composite()
                        .build(),
                StageSpec.named(SNAPSHOT)
                        .runs(registry.resolve(SNAPSHOT))
                        .dependsOn(TRUTH)
                        .timeout(timeouts.apply(SNAPSHOT))
                        .build(),
                StageSpec.named(NOTIFY)
                        .runs(registry.resolve(NOTIFY))
                        .dependsOn(SNAPSHOT)
                        .timeout(timeouts.apply(NOTIFY))
                        .build(),
                StageSpec.named(MAINTENANCE)
                        .runs(registry.resolve(MAINTENANCE))
                        .schedule(maintenanceSchedule)
                        .timeout(timeouts.apply(MAINTENANCE))
                        .build());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /** Restore health state. Must be called once before the first cycle. */
    public PersistenceMode start() {
        PersistenceMode mode = ledger.restore();
        log.info("Cycle orchestrator ready: stages {} (health persistence {})", pipeline.stageNames(), mode);
        return mode;
    }

    /**
     * Run cycles until the trigger says stop.
     *
     * @throws OrchestratorBookkeepingException on a fatal bookkeeping failure
     */
    public void runUntilStopped(CycleTrigger trigger) {
        while (trigger.awaitNext()) {
            runCycle();
        }
        log.info("Cycle loop stopped");
    }

    /**
     * Run one cycle now.
     *
     * @return the finished cycle, or empty if another cycle is still running
     * @throws OrchestratorBookkeepingException on a fatal bookkeeping failure
     */
    public Optional<CycleResult> runCycle() {
        if (!cycleLock.tryLock()) {
            log.warn("Cycle refused: the previous cycle has not finished");
            return Optional.empty();
        }
        try {
            return Optional.of(runLocked());
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult runLocked() {
        long    number    = ledger.beginCycle();
        Instant startedAt = clock.instant();
        String  cycleId   = cycleId(startedAt, number);

        MDC.put("cycleId", cycleId);
        MDC.put("cycleNumber", Long.toString(number));
        phase = CyclePhase.RUNNING;
        try {
            log.info("Cycle {} started", cycleId);
            CycleResult cycle = CycleResult.start(cycleId, number, startedAt)
                    .addAll(pipeline.run(CycleContext.topLevel(cycleId, number)))
                    .finish(clock.instant());

            ledger.completeCycle(cycle);
            append(cycle);

            phase     = cycle.getPhase();
            lastPhase = phase;
            publish(cycle, ledger.snapshot());
            return cycle;
        } finally {
            phase = CyclePhase.IDLE;
            MDC.remove("cycleId");
            MDC.remove("cycleNumber");
        }
    }

    private void append(CycleResult cycle) {
        try {
            records.append(cycle);
        } catch (OrchestratorBookkeepingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("FATAL: could not append cycle {} to the cycle history", cycle.getCycleId(), e);
            throw new OrchestratorBookkeepingException("Cannot record cycle " + cycle.getCycleId(), e);
        }
    }

    private void publish(CycleResult cycle, HealthSnapshot health) {
        for (CycleObserver observer : observers) {
            try {
                observer.onCycleFinished(cycle, health);
            } catch (RuntimeException e) {
                log.error("Cycle observer {} failed for cycle {}",
                        observer.getClass().getSimpleName(), cycle.getCycleId(), e);
            }
        }
    }

    static String cycleId(Instant startedAt, long number) {
        return "cycle-" + CYCLE_ID_TIME.format(startedAt) + "-" + number;
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public CyclePhase phase() {
        return phase;
    }

    /** Phase the most recent cycle ended in (HEALTHY or DEGRADED), or empty before the first cycle. */
    public Optional<CyclePhase> lastPhase() {
        return Optional.ofNullable(lastPhase);
    }

    public boolean isCycleRunning() {
        return cycleLock.isLocked();
    }

    public HealthSnapshot healthSnapshot() {
        return ledger.snapshot();
    }

    public PersistenceMode persistenceMode() {
        return ledger.persistenceMode();
    }

    public CycleRecordStore cycleRecords() {
        return records;
    }
}
