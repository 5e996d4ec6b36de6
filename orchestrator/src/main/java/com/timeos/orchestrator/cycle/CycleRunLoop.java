package com.timeos.orchestrator.cycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/**
 * Owns the run-loop thread. Started and stopped with the Spring context.
 *
 * On stop, the shutdown signal cuts any retry or inter-cycle wait short; the
 * in-flight stage finishes or hits its timeout, the rest of the cycle is
 * recorded as skipped, and the thread exits.
 */
public class CycleRunLoop implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CycleRunLoop.class);

    public enum LoopStatus { NOT_STARTED, RUNNING, STOPPED, HALTED }

    private final CycleOrchestrator orchestrator;
    private final CycleTrigger      trigger;
    private final ShutdownSignal    shutdown;
    private final RunMode           mode;
    private final Duration          stopTimeout;

    private volatile LoopStatus status = LoopStatus.NOT_STARTED;
    private Thread thread;

    public CycleRunLoop(CycleOrchestrator orchestrator,
                        CycleTrigger trigger,
                        ShutdownSignal shutdown,
                        RunMode mode,
                        Duration stopTimeout) {
        this.orchestrator = orchestrator;
        this.trigger      = trigger;
        this.shutdown     = shutdown;
        this.mode         = mode;
        this.stopTimeout  = stopTimeout;
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        orchestrator.start();
        if (mode == RunMode.OFF) {
            log.info("Run mode OFF: no cycles will be started");
            return;
        }
        status = LoopStatus.RUNNING;
        thread = new Thread(this::loop, "cycle-run-loop");
        thread.start();
        log.info("Cycle run loop started (mode {})", mode);
    }

    private void loop() {
        try {
            orchestrator.runUntilStopped(trigger);
            status = LoopStatus.STOPPED;
        } catch (OrchestratorBookkeepingException e) {
            status = LoopStatus.HALTED;
            log.error("==================================================================");
            log.error("CYCLE RUN LOOP HALTED: orchestrator bookkeeping failed: {}", e.getMessage(), e);
            log.error("No further cycles will run until the process is restarted.");
            log.error("==================================================================");
        }
    }

    @Override
    public void stop() {
        shutdown.requestShutdown();
        Thread running;
        synchronized (this) {
            running = thread;
        }
        if (running == null) {
            return;
        }
        try {
            running.join(stopTimeout.toMillis());
            if (running.isAlive()) {
                log.warn("Cycle run loop still busy after {}; leaving it to finish in the background", stopTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the cycle run loop to stop");
        }
        if (status == LoopStatus.RUNNING && !running.isAlive()) {
            status = LoopStatus.STOPPED;
        }
    }

    @Override
    public boolean isRunning() {
        return status == LoopStatus.RUNNING;
    }

    public LoopStatus status() {
        return status;
    }

    public RunMode mode() {
        return mode;
    }
}
