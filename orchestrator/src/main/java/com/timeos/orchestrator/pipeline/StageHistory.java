package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.JobResult;

import java.time.Instant;
import java.util.Optional;

/**
 * What a pipeline needs from the health bookkeeping: the last-known-good
 * markers used to compute upstream freshness, and a sink for each stage
 * outcome as soon as it is known.
 */
public interface StageHistory {

    /** When the stage last produced output (SUCCESS or PARTIAL), if ever. */
    Optional<Instant> lastOutputAt(String stage);

    /** When the stage function was last actually invoked, if ever. */
    Optional<Instant> lastRunAt(String stage);

    /**
     * Record one stage outcome and persist it.
     *
     * @throws com.timeos.orchestrator.cycle.OrchestratorBookkeepingException
     *         if the outcome cannot be persisted
     */
    void record(CycleContext cycle, JobResult result);

    /**
     * Record the outcome of a composite stage. Its children carry the failure
     * counters and circuits, so only the run and output markers move.
     *
     * @throws com.timeos.orchestrator.cycle.OrchestratorBookkeepingException
     *         if the outcome cannot be persisted
     */
    void recordComposite(CycleContext cycle, JobResult result);
}
