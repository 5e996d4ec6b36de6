package com.timeos.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one full orchestrator pass.
 *
 * Built incrementally through {@link Builder} while the cycle runs, then
 * frozen by {@link Builder#finish(Instant)}. A finished CycleResult is never
 * mutated; it is persisted to the cycle history and handed to observers.
 */
public final class CycleResult {

    private final String          cycleId;
    private final long            cycleNumber;
    private final Instant         startedAt;
    private final Instant         finishedAt;
    private final List<JobResult> jobs;

    private CycleResult(String cycleId, long cycleNumber, Instant startedAt,
                        Instant finishedAt, List<JobResult> jobs) {
        this.cycleId     = cycleId;
        this.cycleNumber = cycleNumber;
        this.startedAt   = startedAt;
        this.finishedAt  = finishedAt;
        this.jobs        = List.copyOf(jobs);
    }

    public static Builder start(String cycleId, long cycleNumber, Instant startedAt) {
        return new Builder(cycleId, cycleNumber, startedAt);
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public String          getCycleId()     { return cycleId; }
    public long            getCycleNumber() { return cycleNumber; }
    public Instant         getStartedAt()   { return startedAt; }
    public Instant         getFinishedAt()  { return finishedAt; }
    public List<JobResult> getJobs()        { return jobs; }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * True iff no top-level stage FAILED. SKIPPED stages never make a cycle
     * unhealthy on their own.
     */
    public boolean isHealthy() {
        return jobs.stream().noneMatch(j -> j.status() == StageStatus.FAILED);
    }

    /** True if any stage, at any depth, ran against stale or absent input. */
    public boolean isDegradedInput() {
        return anyDegraded(jobs);
    }

    public CyclePhase getPhase() {
        return isHealthy() && !isDegradedInput() ? CyclePhase.HEALTHY : CyclePhase.DEGRADED;
    }

    public List<String> getFailedJobs() {
        return jobs.stream().filter(j -> j.status() == StageStatus.FAILED)
                .map(JobResult::jobName).toList();
    }

    public List<String> getSucceededJobs() {
        return jobs.stream().filter(j -> j.status().producedOutput())
                .map(JobResult::jobName).toList();
    }

    public List<String> getSkippedJobs() {
        return jobs.stream().filter(j -> j.status() == StageStatus.SKIPPED)
                .map(JobResult::jobName).toList();
    }

    private static boolean anyDegraded(List<JobResult> results) {
        for (JobResult r : results) {
            if (r.ranOnDegradedInput() || anyDegraded(r.children())) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "CycleResult{" + cycleId + ", healthy=" + isHealthy()
                + ", failed=" + getFailedJobs() + "}";
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    /**
     * Mutable draft of a cycle. Not thread-safe: only the run-loop thread
     * appends to it.
     */
    public static final class Builder {

        private final String          cycleId;
        private final long            cycleNumber;
        private final Instant         startedAt;
        private final List<JobResult> jobs = new ArrayList<>();
        private boolean finished;

        private Builder(String cycleId, long cycleNumber, Instant startedAt) {
            this.cycleId     = Objects.requireNonNull(cycleId, "cycleId");
            this.cycleNumber = cycleNumber;
            this.startedAt   = Objects.requireNonNull(startedAt, "startedAt");
        }

        public String  cycleId()     { return cycleId; }
        public long    cycleNumber() { return cycleNumber; }
        public Instant startedAt()   { return startedAt; }

        public Builder add(JobResult result) {
            if (finished) {
                throw new IllegalStateException("cycle " + cycleId + " is already finalised");
            }
            jobs.add(Objects.requireNonNull(result, "result"));
            return this;
        }

        public Builder addAll(List<JobResult> results) {
            results.forEach(this::add);
            return this;
        }

        public CycleResult finish(Instant finishedAt) {
            if (finished) {
                throw new IllegalStateException("cycle " + cycleId + " is already finalised");
            }
            finished = true;
            Instant end = finishedAt.isBefore(startedAt) ? startedAt : finishedAt;
            return new CycleResult(cycleId, cycleNumber, startedAt, end, jobs);
        }
    }
}
