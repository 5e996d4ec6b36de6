package com.timeos.orchestrator.health;

import com.timeos.orchestrator.cycle.OrchestratorBookkeepingException;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.pipeline.StageHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Single writer of the {@link HealthState}.
 *
 * <p>Every stage outcome passes through {@link #record}: counters are updated,
 * the {@link CircuitBreaker} is told the result, and the whole state is saved
 * before the next stage starts. Composite stages go through
 * {@link #recordComposite} and never get a circuit. Cycle boundaries go through
 * {@link #beginCycle()} and {@link #completeCycle}.
 *
 * <p>Any save failure is fatal and surfaces as
 * {@link OrchestratorBookkeepingException}.
 */
public class HealthLedger implements StageHistory {

    private static final Logger log = LoggerFactory.getLogger(HealthLedger.class);

    private final HealthState    state;
    private final CircuitBreaker breaker;
    private final boolean        fallbackToMemory;

    private HealthStateStore store;
    private PersistenceMode  mode;

    public HealthLedger(HealthState state, CircuitBreaker breaker,
                        HealthStateStore store, boolean fallbackToMemory) {
        this.state            = state;
        this.breaker          = breaker;
        this.store            = store;
        this.fallbackToMemory = fallbackToMemory;
        this.mode             = store.durable() ? PersistenceMode.DURABLE : PersistenceMode.IN_MEMORY;
    }

    // ------------------------------------------------------------------
    // Startup
    // ------------------------------------------------------------------

    /**
     * Load the saved state into the live {@link HealthState}. Called once,
     * before the first cycle.
     *
     * If the store cannot be read and fallback is allowed, bookkeeping
     * continues in memory and the downgrade is logged at ERROR.
     */
    public synchronized PersistenceMode restore() {
        try {
            Optional<HealthState> saved = store.load();
            saved.ifPresent(state::replaceWith);
            log.info("Health state restored ({} stages, cycle count {}, persistence {})",
                    state.stages().size(), state.getCycleCount(), mode);
        } catch (HealthPersistenceException e) {
            if (!fallbackToMemory) {
                throw new OrchestratorBookkeepingException("Cannot load health state", e);
            }
            log.error("==================================================================");
            log.error("HEALTH STATE PERSISTENCE UNAVAILABLE: {}", e.getMessage(), e);
            log.error("Falling back to IN-MEMORY health state. Circuit breakers and failure");
            log.error("counters will RESET on restart until the store is repaired.");
            log.error("==================================================================");
            store = new InMemoryHealthStateStore();
            mode  = PersistenceMode.IN_MEMORY;
        }
        return mode;
    }

    public synchronized PersistenceMode persistenceMode() {
        return mode;
    }

    // ------------------------------------------------------------------
    // Cycle boundaries
    // ------------------------------------------------------------------

    /** Advance and persist the cycle counter; returns the new cycle number. */
    public synchronized long beginCycle() {
        long number = state.nextCycleNumber();
        save("cycle " + number + " start");
        return number;
    }

    /** Fold a finished cycle into the cycle-level fields and persist them. */
    public synchronized void completeCycle(CycleResult cycle) {
        state.setLastCycleId(cycle.getCycleId());
        if (cycle.isHealthy()) {
            state.setLastSuccessfulCycle(cycle.getFinishedAt());
        }
        state.setDegraded(!cycle.isHealthy()
                || cycle.isDegradedInput()
                || !state.circuitBrokenJobs().isEmpty());
        save("cycle " + cycle.getCycleId() + " end");
    }

    // ------------------------------------------------------------------
    // StageHistory
    // ------------------------------------------------------------------

    @Override
    public Optional<Instant> lastOutputAt(String stage) {
        return state.findStage(stage).map(StageHealth::getLastOutputAt);
    }

    @Override
    public Optional<Instant> lastRunAt(String stage) {
        return state.findStage(stage).map(StageHealth::getLastRunAt);
    }

    @Override
    public synchronized void record(CycleContext cycle, JobResult result) {
        String  name     = result.jobName();
        Instant finished = result.startedAt().plus(result.duration());

        StageHealthLevel before;
        synchronized (state) {
            StageHealth health = state.stage(name);
            before = health.level();

            if (result.executed()) {
                health.recordRun(result.startedAt());
            }
            if (isFailure(result)) {
                health.recordFailure(result.error());
                breaker.recordFailure(name, cycle.cycleNumber(), finished);
            } else if (result.status().producedOutput()) {
                health.recordOutput(finished);
                breaker.recordSuccess(name);
            }
            health.setLastStatus(result.status());

            StageHealthLevel after = health.level();
            if (after != before) {
                log.warn("Stage '{}' health {} -> {} ({} consecutive failures)",
                        name, before, after, health.getConsecutiveFailures());
            }
        }
        save("stage " + name);
    }

    @Override
    public synchronized void recordComposite(CycleContext cycle, JobResult result) {
        String name = result.jobName();
        synchronized (state) {
            StageHealth health = state.stage(name);
            if (result.executed()) {
                health.recordRun(result.startedAt());
            }
            if (result.status().producedOutput()) {
                health.recordOutput(result.startedAt().plus(result.duration()));
            }
            health.setLastStatus(result.status());
        }
        save("stage " + name);
    }

    /**
     * A FAILED result, or a probe that was recorded as SKIPPED because it
     * failed. Plain skips leave every counter alone.
     */
    static boolean isFailure(JobResult result) {
        if (result.status() == StageStatus.FAILED) return true;
        return result.probe() && result.status() == StageStatus.SKIPPED && result.error() != null;
    }

    // ------------------------------------------------------------------
    // Read side
    // ------------------------------------------------------------------

    public HealthSnapshot snapshot() {
        return state.snapshot();
    }

    public HealthState state() {
        return state;
    }

    private void save(String after) {
        try {
            store.save(state);
        } catch (HealthPersistenceException e) {
            log.error("FATAL: could not persist health state after {}", after, e);
            throw new OrchestratorBookkeepingException("Cannot persist health state after " + after, e);
        }
    }
}
