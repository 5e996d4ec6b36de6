package com.timeos.orchestrator.pipeline;

import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a stage should run in the current cycle.
 * Most stages run every cycle; maintenance runs once a day.
 */
@FunctionalInterface
public interface StageSchedule {

    StageSchedule EVERY_CYCLE = (now, lastRunAt) -> true;

    /**
     * @param now       start of the current stage slot
     * @param lastRunAt when the stage last actually executed, if ever
     */
    boolean isDue(Instant now, Optional<Instant> lastRunAt);
}
