package com.timeos.orchestrator.cycle;

import java.time.Duration;

/**
 * Fires immediately, then once per {@code interval} measured from the end of
 * the previous cycle. Stops as soon as shutdown is requested.
 */
public class IntervalTrigger implements CycleTrigger {

    private final ShutdownSignal shutdown;
    private final Duration       interval;
    private boolean first = true;

    public IntervalTrigger(ShutdownSignal shutdown, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("cycle interval must be positive");
        }
        this.shutdown = shutdown;
        this.interval = interval;
    }

    @Override
    public boolean awaitNext() {
        if (shutdown.isShutdownRequested()) {
            return false;
        }
        if (first) {
            first = false;
            return true;
        }
        return shutdown.pause(interval);
    }
}
