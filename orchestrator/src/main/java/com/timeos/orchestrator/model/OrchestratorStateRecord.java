package com.timeos.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Singleton row holding the cycle-level health fields.
 *
 * DB table: orchestrator_state  (created by Flyway V1 migration; id is always 1)
 */
@Entity
@Table(name = "orchestrator_state")
public class OrchestratorStateRecord {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id = SINGLETON_ID;

    @Column(name = "cycle_count", nullable = false)
    private long cycleCount;

    @Column(name = "last_cycle_id")
    private String lastCycleId;

    @Column(name = "last_successful_cycle")
    private Instant lastSuccessfulCycle;

    @Column(nullable = false)
    private boolean degraded;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    public OrchestratorStateRecord() {}

    public Integer getId()                  { return id; }
    public long    getCycleCount()          { return cycleCount; }
    public String  getLastCycleId()         { return lastCycleId; }
    public Instant getLastSuccessfulCycle() { return lastSuccessfulCycle; }
    public boolean isDegraded()             { return degraded; }
    public Instant getUpdatedAt()           { return updatedAt; }

    public void setCycleCount(long n)               { this.cycleCount = n; }
    public void setLastCycleId(String id)           { this.lastCycleId = id; }
    public void setLastSuccessfulCycle(Instant t)   { this.lastSuccessfulCycle = t; }
    public void setDegraded(boolean degraded)       { this.degraded = degraded; }
    public void setUpdatedAt(Instant t)             { this.updatedAt = t; }
}
