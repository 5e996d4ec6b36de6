package com.timeos.orchestrator.cycle;

/**
 * Source of cycle ticks for {@link CycleOrchestrator#runUntilStopped}.
 */
@FunctionalInterface
public interface CycleTrigger {

    /**
     * Block until the next cycle is due.
     *
     * @return false when no further cycle should start
     */
    boolean awaitNext();
}
