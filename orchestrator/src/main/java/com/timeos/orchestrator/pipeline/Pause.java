package com.timeos.orchestrator.pipeline;

import java.time.Duration;

/**
 * A cancellable wait. Used for the retry delay and the gap between cycles.
 */
@FunctionalInterface
public interface Pause {

    /**
     * Block for up to {@code duration}.
     *
     * @return true if the full duration elapsed, false if the wait was cut
     *         short by a shutdown request or an interrupt
     */
    boolean pause(Duration duration);
}
