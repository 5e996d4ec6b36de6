package com.timeos.orchestrator.health;

import com.timeos.orchestrator.model.StageStatus;

import java.time.Instant;

/**
 * Health record of one stage, carried across cycles.
 *
 * Consecutive failures live in the stage's {@link CircuitState} so the two
 * can never disagree.
 */
public final class StageHealth {

    private final String       name;
    private final CircuitState circuit;

    private long        totalRuns;
    private long        totalFailures;
    private Instant     lastRunAt;
    private Instant     lastOutputAt;
    private String      lastError;
    private StageStatus lastStatus;

    public StageHealth(String name) {
        this(name, new CircuitState());
    }

    StageHealth(String name, CircuitState circuit) {
        this.name    = name;
        this.circuit = circuit;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String       getName()                { return name; }
    public CircuitState getCircuit()             { return circuit; }
    public int          getConsecutiveFailures() { return circuit.getConsecutiveFailures(); }
    public long         getTotalRuns()           { return totalRuns; }
    public long         getTotalFailures()       { return totalFailures; }
    public Instant      getLastRunAt()           { return lastRunAt; }
    public Instant      getLastOutputAt()        { return lastOutputAt; }
    public String       getLastError()           { return lastError; }
    public StageStatus  getLastStatus()          { return lastStatus; }

    public StageHealthLevel level() {
        return StageHealthLevel.of(getConsecutiveFailures());
    }

    // ------------------------------------------------------------------
    // Mutators (called by HealthLedger under the HealthState monitor)
    // ------------------------------------------------------------------

    void recordRun(Instant at)                { totalRuns++; lastRunAt = at; }
    void recordOutput(Instant at)             { lastOutputAt = at; lastError = null; }
    void recordFailure(String error)          { totalFailures++; lastError = truncate(error); }
    void setLastStatus(StageStatus status)    { this.lastStatus = status; }

    public static StageHealth restore(String name, CircuitState circuit, long totalRuns, long totalFailures,
                               Instant lastRunAt, Instant lastOutputAt, String lastError,
                               StageStatus lastStatus) {
        StageHealth h = new StageHealth(name, circuit);
        h.totalRuns     = totalRuns;
        h.totalFailures = totalFailures;
        h.lastRunAt     = lastRunAt;
        h.lastOutputAt  = lastOutputAt;
        h.lastError     = lastError;
        h.lastStatus    = lastStatus;
        return h;
    }

    StageHealth copy() {
        return restore(name, circuit.copy(), totalRuns, totalFailures,
                lastRunAt, lastOutputAt, lastError, lastStatus);
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= 500 ? error : error.substring(0, 500);
    }
}
