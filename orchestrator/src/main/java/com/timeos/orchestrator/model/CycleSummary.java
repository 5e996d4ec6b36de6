package com.timeos.orchestrator.model;

import java.time.Instant;
import java.util.List;

/**
 * One line of cycle history: enough to list recent cycles without loading
 * every JobResult.
 */
public record CycleSummary(
        String       cycleId,
        long         cycleNumber,
        Instant      startedAt,
        Instant      finishedAt,
        boolean      healthy,
        CyclePhase   phase,
        List<String> failedJobs) {

    public CycleSummary {
        failedJobs = failedJobs == null ? List.of() : List.copyOf(failedJobs);
    }

    public static CycleSummary of(CycleResult cycle) {
        return new CycleSummary(cycle.getCycleId(), cycle.getCycleNumber(), cycle.getStartedAt(),
                cycle.getFinishedAt(), cycle.isHealthy(), cycle.getPhase(), cycle.getFailedJobs());
    }
}
