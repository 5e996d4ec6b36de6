package com.timeos.orchestrator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one stage execution within one cycle.
 *
 * Created by the job runner once the stage's final attempt is known and never
 * changed afterwards. The owning {@link CycleResult} keeps it for the lifetime
 * of the cycle record.
 *
 * @param jobName        stage name
 * @param status         final status for this cycle
 * @param startedAt      when the first attempt started (or when the skip was decided)
 * @param duration       wall time across all attempts, including the retry pause
 * @param error          last error, or null
 * @param itemsProcessed records handled by the stage
 * @param note           skip reason, staleness note or other non-error detail
 * @param attempts       how many times the stage function was invoked (0 if skipped)
 * @param probe          true if this run was a half-open circuit probe
 * @param upstream       freshness of each declared dependency at start time
 * @param children       nested results (composite stages only)
 */
public record JobResult(
        String                     jobName,
        StageStatus                status,
        Instant                    startedAt,
        Duration                   duration,
        String                     error,
        long                       itemsProcessed,
        String                     note,
        int                        attempts,
        boolean                    probe,
        Map<String, UpstreamState> upstream,
        List<JobResult>            children) {

    public JobResult {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        duration = duration == null ? Duration.ZERO : duration;
        if (itemsProcessed < 0) {
            throw new IllegalArgumentException("itemsProcessed must be >= 0");
        }
        // Keep declaration order so reports list dependencies the way they were wired.
        upstream = upstream == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(upstream));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** A result for a stage that was not invoked at all. */
    public static JobResult skipped(String jobName, Instant at, String reason,
                                    Map<String, UpstreamState> upstream) {
        return new JobResult(jobName, StageStatus.SKIPPED, at, Duration.ZERO,
                null, 0, reason, 0, false, upstream, List.of());
    }

    /** True if the stage function was actually invoked this cycle. */
    public boolean executed() {
        return attempts > 0;
    }

    /** True if any declared dependency was not FRESH. */
    public boolean ranOnDegradedInput() {
        return executed() && upstream.values().stream().anyMatch(s -> s != UpstreamState.FRESH);
    }

    /**
     * Compares everything except timing fields. Two runs over the same
     * deterministic inputs must agree on this.
     */
    public boolean sameOutcomeAs(JobResult other) {
        if (other == null) return false;
        if (!jobName.equals(other.jobName)
                || status != other.status
                || itemsProcessed != other.itemsProcessed
                || attempts != other.attempts
                || probe != other.probe
                || !Objects.equals(error, other.error)
                || !Objects.equals(note, other.note)
                || !upstream.equals(other.upstream)
                || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameOutcomeAs(other.children.get(i))) return false;
        }
        return true;
    }
}
