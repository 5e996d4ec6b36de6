package com.timeos.orchestrator.cycle;

/** Fires exactly once (run-once mode). */
public class SingleShotTrigger implements CycleTrigger {

    private final ShutdownSignal shutdown;
    private boolean fired;

    public SingleShotTrigger(ShutdownSignal shutdown) {
        this.shutdown = shutdown;
    }

    @Override
    public boolean awaitNext() {
        if (fired || shutdown.isShutdownRequested()) {
            return false;
        }
        fired = true;
        return true;
    }
}
