package com.timeos.orchestrator.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Per-stage circuit breaker, keyed by stage name and long-lived across cycles.
 *
 * <p>The breaker never throws. It answers one question per stage per cycle
 * ({@link #admit}) and is told the stage's final status for the cycle
 * ({@link #recordSuccess} / {@link #recordFailure}). All state lives in the
 * shared {@link HealthState}, so {@code circuitBrokenJobs} is derived from the
 * circuits and cannot drift from them.
 *
 * <pre>
 *   CLOSED --(openThreshold consecutive failed cycles)--> OPEN
 *   OPEN   --(resetThreshold consecutive successful probes)--> CLOSED
 * </pre>
 *
 * While OPEN, one probe execution is admitted every {@code probeEveryCycles}
 * cycles. A failed probe resets the probe streak but leaves the circuit open.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_OPEN_THRESHOLD  = 3;
    public static final int DEFAULT_RESET_THRESHOLD = 5;

    /** What the breaker allows for a stage in the current cycle. */
    public enum Admission {
        /** Circuit closed: run normally, with retry. */
        ALLOW,
        /** Circuit open, probe due: run once, no retry. */
        PROBE,
        /** Circuit open, no probe due: skip without running. */
        REJECT
    }

    /** Circuit movement caused by one recorded outcome. */
    public enum Transition { NONE, OPENED, CLOSED }

    private final HealthState state;
    private final int         openThreshold;
    private final int         resetThreshold;
    private final int         probeEveryCycles;

    public CircuitBreaker(HealthState state) {
        this(state, DEFAULT_OPEN_THRESHOLD, DEFAULT_RESET_THRESHOLD, 1);
    }

    public CircuitBreaker(HealthState state, int openThreshold, int resetThreshold, int probeEveryCycles) {
        if (openThreshold < 1 || resetThreshold < 1 || probeEveryCycles < 1) {
            throw new IllegalArgumentException("circuit thresholds and probe interval must be >= 1");
        }
        this.state            = state;
        this.openThreshold    = openThreshold;
        this.resetThreshold   = resetThreshold;
        this.probeEveryCycles = probeEveryCycles;
    }

    /**
     * Decide whether {@code stage} may execute in cycle {@code cycleNumber}.
     * Granting a probe marks it as taken for that cycle.
     */
    public Admission admit(String stage, long cycleNumber) {
        synchronized (state) {
            CircuitState circuit = state.stage(stage).getCircuit();
            if (!circuit.isOpen()) {
                return Admission.ALLOW;
            }
            if (cycleNumber - circuit.getLastProbeCycle() >= probeEveryCycles) {
                circuit.markProbe(cycleNumber);
                return Admission.PROBE;
            }
            return Admission.REJECT;
        }
    }

    /** The stage ran and did not fail (SUCCESS or PARTIAL). */
    public Transition recordSuccess(String stage) {
        synchronized (state) {
            CircuitState circuit = state.stage(stage).getCircuit();
            if (!circuit.isOpen()) {
                circuit.resetFailures();
                return Transition.NONE;
            }
            circuit.incrementProbeSuccesses();
            if (circuit.getSuccessesSinceOpen() >= resetThreshold) {
                circuit.close();
                log.info("Circuit CLOSED for stage '{}' after {} successful probes", stage, resetThreshold);
                return Transition.CLOSED;
            }
            log.info("Probe succeeded for stage '{}' ({}/{})",
                    stage, circuit.getSuccessesSinceOpen(), resetThreshold);
            return Transition.NONE;
        }
    }

    /** The stage's final status this cycle was a failure (including a failed probe). */
    public Transition recordFailure(String stage, long cycleNumber, Instant at) {
        synchronized (state) {
            CircuitState circuit = state.stage(stage).getCircuit();
            circuit.incrementFailures();
            if (circuit.isOpen()) {
                circuit.resetProbeSuccesses();
                log.warn("Probe failed for stage '{}'; circuit stays OPEN ({} consecutive failures)",
                        stage, circuit.getConsecutiveFailures());
                return Transition.NONE;
            }
            if (circuit.getConsecutiveFailures() >= openThreshold) {
                circuit.open(cycleNumber, at);
                log.warn("Circuit OPENED for stage '{}' after {} consecutive failed cycles",
                        stage, circuit.getConsecutiveFailures());
                return Transition.OPENED;
            }
            return Transition.NONE;
        }
    }

    public boolean isOpen(String stage) {
        return state.findStage(stage).map(s -> s.getCircuit().isOpen()).orElse(false);
    }

    public int openThreshold()    { return openThreshold; }
    public int resetThreshold()   { return resetThreshold; }
    public int probeEveryCycles() { return probeEveryCycles; }
}
