package com.timeos.orchestrator.model;

import com.timeos.orchestrator.health.CircuitStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Persisted health of one stage: counters plus its circuit state.
 *
 * DB table: stage_health  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_health")
public class StageHealthRecord {

    @Id
    @Column(name = "stage_name", nullable = false, updatable = false)
    private String stageName;

    @Enumerated(EnumType.STRING)
    @Column(name = "circuit_status", nullable = false)
    private CircuitStatus circuitStatus = CircuitStatus.CLOSED;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "successes_since_open", nullable = false)
    private int successesSinceOpen;

    @Column(name = "circuit_opened_at")
    private Instant circuitOpenedAt;

    @Column(name = "circuit_opened_at_cycle", nullable = false)
    private long circuitOpenedAtCycle;

    @Column(name = "last_probe_cycle", nullable = false)
    private long lastProbeCycle;

    @Column(name = "total_runs", nullable = false)
    private long totalRuns;

    @Column(name = "total_failures", nullable = false)
    private long totalFailures;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    // Last-known-good marker: downstream stages fall back to this output.
    @Column(name = "last_output_at")
    private Instant lastOutputAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status")
    private StageStatus lastStatus;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StageHealthRecord() {}   // required by JPA

    public StageHealthRecord(String stageName) {
        this.stageName = stageName;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String        getStageName()            { return stageName; }
    public CircuitStatus getCircuitStatus()        { return circuitStatus; }
    public int           getConsecutiveFailures()  { return consecutiveFailures; }
    public int           getSuccessesSinceOpen()   { return successesSinceOpen; }
    public Instant       getCircuitOpenedAt()      { return circuitOpenedAt; }
    public long          getCircuitOpenedAtCycle() { return circuitOpenedAtCycle; }
    public long          getLastProbeCycle()       { return lastProbeCycle; }
    public long          getTotalRuns()            { return totalRuns; }
    public long          getTotalFailures()        { return totalFailures; }
    public Instant       getLastRunAt()            { return lastRunAt; }
    public Instant       getLastOutputAt()         { return lastOutputAt; }
    public String        getLastError()            { return lastError; }
    public StageStatus   getLastStatus()           { return lastStatus; }
    public Instant       getUpdatedAt()            { return updatedAt; }

    public void setCircuitStatus(CircuitStatus s)        { this.circuitStatus = s; }
    public void setConsecutiveFailures(int n)            { this.consecutiveFailures = n; }
    public void setSuccessesSinceOpen(int n)             { this.successesSinceOpen = n; }
    public void setCircuitOpenedAt(Instant t)            { this.circuitOpenedAt = t; }
    public void setCircuitOpenedAtCycle(long n)          { this.circuitOpenedAtCycle = n; }
    public void setLastProbeCycle(long n)                { this.lastProbeCycle = n; }
    public void setTotalRuns(long n)                     { this.totalRuns = n; }
    public void setTotalFailures(long n)                 { this.totalFailures = n; }
    public void setLastRunAt(Instant t)                  { this.lastRunAt = t; }
    public void setLastOutputAt(Instant t)               { this.lastOutputAt = t; }
    public void setLastError(String lastError)           { this.lastError = lastError; }
    public void setLastStatus(StageStatus lastStatus)    { this.lastStatus = lastStatus; }
    public void setUpdatedAt(Instant t)                  { this.updatedAt = t; }
}
