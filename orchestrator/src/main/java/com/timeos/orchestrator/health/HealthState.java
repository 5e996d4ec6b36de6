package com.timeos.orchestrator.health;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Process-wide health record: per-stage counters and circuits, the cycle
 * counter, and the last successful cycle.
 *
 * There is exactly one instance per orchestrator. It has a single writer
 * (the {@link HealthLedger} on the run-loop thread); readers such as the
 * health endpoint get an immutable {@link HealthSnapshot}. All access goes
 * through this object's monitor.
 */
public final class HealthState {

    private final Map<String, StageHealth> stages = new TreeMap<>();

    private long    cycleCount;
    private String  lastCycleId;
    private Instant lastSuccessfulCycle;
    private boolean degraded;

    // ------------------------------------------------------------------
    // Stage records
    // ------------------------------------------------------------------

    synchronized StageHealth stage(String name) {
        return stages.computeIfAbsent(name, StageHealth::new);
    }

    synchronized Optional<StageHealth> findStage(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    /** Detached copies of every stage record, for persistence. */
    public synchronized List<StageHealth> stages() {
        return stages.values().stream().map(StageHealth::copy).toList();
    }

    /** Names of every stage whose circuit is currently OPEN, sorted. */
    public synchronized List<String> circuitBrokenJobs() {
        return stages.values().stream()
                .filter(s -> s.getCircuit().isOpen())
                .map(StageHealth::getName)
                .toList();
    }

    public synchronized Map<String, Integer> consecutiveFailures() {
        Map<String, Integer> out = new LinkedHashMap<>();
        stages.forEach((name, s) -> out.put(name, s.getConsecutiveFailures()));
        return out;
    }

    // ------------------------------------------------------------------
    // Cycle-level fields
    // ------------------------------------------------------------------

    public synchronized long    getCycleCount()          { return cycleCount; }
    public synchronized String  getLastCycleId()         { return lastCycleId; }
    public synchronized Instant getLastSuccessfulCycle() { return lastSuccessfulCycle; }
    public synchronized boolean isDegraded()             { return degraded; }

    synchronized long nextCycleNumber()                      { return ++cycleCount; }
    synchronized void setLastCycleId(String id)              { this.lastCycleId = id; }
    synchronized void setLastSuccessfulCycle(Instant at)     { this.lastSuccessfulCycle = at; }
    synchronized void setDegraded(boolean degraded)          { this.degraded = degraded; }

    // ------------------------------------------------------------------
    // Restore / copy
    // ------------------------------------------------------------------

    /** Builds a state read back from storage. */
    public static HealthState restore(long cycleCount, String lastCycleId, Instant lastSuccessfulCycle,
                                      boolean degraded, List<StageHealth> stages) {
        HealthState s = new HealthState();
        s.cycleCount          = cycleCount;
        s.lastCycleId         = lastCycleId;
        s.lastSuccessfulCycle = lastSuccessfulCycle;
        s.degraded            = degraded;
        stages.forEach(h -> s.stages.put(h.getName(), h));
        return s;
    }

    /** Replace this instance's contents with a deep copy of {@code other}. */
    public void replaceWith(HealthState other) {
        HealthState source = other.copy();
        synchronized (this) {
            stages.clear();
            stages.putAll(source.stages);
            cycleCount          = source.cycleCount;
            lastCycleId         = source.lastCycleId;
            lastSuccessfulCycle = source.lastSuccessfulCycle;
            degraded            = source.degraded;
        }
    }

    public synchronized HealthState copy() {
        return restore(cycleCount, lastCycleId, lastSuccessfulCycle, degraded,
                stages.values().stream().map(StageHealth::copy).toList());
    }

    public synchronized HealthSnapshot snapshot() {
        Map<String, HealthSnapshot.StageView> views = new LinkedHashMap<>();
        stages.forEach((name, s) -> views.put(name, HealthSnapshot.StageView.of(s)));
        return new HealthSnapshot(cycleCount, lastCycleId, lastSuccessfulCycle, degraded,
                circuitBrokenJobs(), consecutiveFailures(), views);
    }
}
