package com.timeos.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One finished cycle in the cycle history.
 *
 * The summary columns serve list queries; result_json holds the full
 * CycleResult (every JobResult, nested truth stages included).
 *
 * DB table: cycle_runs  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "cycle_runs")
public class CycleRun {

    @Id
    @Column(name = "cycle_id", nullable = false, updatable = false)
    private String cycleId;

    @Column(name = "cycle_number", nullable = false)
    private long cycleNumber;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false)
    private Instant finishedAt;

    @Column(nullable = false)
    private boolean healthy;

    @Column(name = "degraded_input", nullable = false)
    private boolean degradedInput;

    // Comma-separated names of the top-level stages that FAILED.
    @Column(name = "failed_jobs", columnDefinition = "TEXT")
    private String failedJobs;

    @Column(name = "result_json", columnDefinition = "TEXT", nullable = false)
    private String resultJson;

    protected CycleRun() {}   // required by JPA

    public CycleRun(CycleResult cycle, String resultJson) {
        this.cycleId       = cycle.getCycleId();
        this.cycleNumber   = cycle.getCycleNumber();
        this.startedAt     = cycle.getStartedAt();
        this.finishedAt    = cycle.getFinishedAt();
        this.healthy       = cycle.isHealthy();
        this.degradedInput = cycle.isDegradedInput();
        this.failedJobs    = String.join(",", cycle.getFailedJobs());
        this.resultJson    = resultJson;
    }

    public String  getCycleId()       { return cycleId; }
    public long    getCycleNumber()   { return cycleNumber; }
    public Instant getStartedAt()     { return startedAt; }
    public Instant getFinishedAt()    { return finishedAt; }
    public boolean isHealthy()        { return healthy; }
    public boolean isDegradedInput()  { return degradedInput; }
    public String  getFailedJobs()    { return failedJobs; }
    public String  getResultJson()    { return resultJson; }
}
