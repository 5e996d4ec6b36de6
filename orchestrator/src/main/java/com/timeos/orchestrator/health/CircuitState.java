package com.timeos.orchestrator.health;

import java.time.Instant;

/**
 * Per-stage circuit breaker state. Mutated only through {@link CircuitBreaker}
 * while holding the {@link HealthState} monitor.
 *
 * Invariant: status is OPEN iff consecutiveFailures reached the open threshold
 * and the stage has not since strung together the reset threshold of
 * successful probes.
 */
public final class CircuitState {

    private CircuitStatus status = CircuitStatus.CLOSED;
    private int     consecutiveFailures;
    private int     successesSinceOpen;
    private Instant openedAt;
    private long    openedAtCycle;
    private long    lastProbeCycle;

    public CircuitStatus getStatus()              { return status; }
    public int           getConsecutiveFailures() { return consecutiveFailures; }
    public int           getSuccessesSinceOpen()  { return successesSinceOpen; }
    public Instant       getOpenedAt()            { return openedAt; }
    public long          getOpenedAtCycle()       { return openedAtCycle; }
    public long          getLastProbeCycle()      { return lastProbeCycle; }

    public boolean isOpen() { return status == CircuitStatus.OPEN; }

    // ------------------------------------------------------------------
    // Transitions (package-private: CircuitBreaker owns the rules)
    // ------------------------------------------------------------------

    void open(long cycleNumber, Instant at) {
        status             = CircuitStatus.OPEN;
        successesSinceOpen = 0;
        openedAt           = at;
        openedAtCycle      = cycleNumber;
        lastProbeCycle     = cycleNumber;
    }

    void close() {
        status              = CircuitStatus.CLOSED;
        consecutiveFailures = 0;
        successesSinceOpen  = 0;
        openedAt            = null;
        openedAtCycle       = 0;
        lastProbeCycle      = 0;
    }

    void incrementFailures()         { consecutiveFailures++; }
    void resetFailures()             { consecutiveFailures = 0; }
    void incrementProbeSuccesses()   { successesSinceOpen++; }
    void resetProbeSuccesses()       { successesSinceOpen = 0; }
    void markProbe(long cycleNumber) { lastProbeCycle = cycleNumber; }

    /** Rebuilds a state read back from storage. */
    public static CircuitState restore(CircuitStatus status, int consecutiveFailures, int successesSinceOpen,
                                Instant openedAt, long openedAtCycle, long lastProbeCycle) {
        CircuitState c = new CircuitState();
        c.status              = status == null ? CircuitStatus.CLOSED : status;
        c.consecutiveFailures = consecutiveFailures;
        c.successesSinceOpen  = successesSinceOpen;
        c.openedAt            = openedAt;
        c.openedAtCycle       = openedAtCycle;
        c.lastProbeCycle      = lastProbeCycle;
        return c;
    }

    CircuitState copy() {
        return restore(status, consecutiveFailures, successesSinceOpen, openedAt, openedAtCycle, lastProbeCycle);
    }
}
