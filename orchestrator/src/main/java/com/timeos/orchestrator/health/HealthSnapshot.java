package com.timeos.orchestrator.health;

import com.timeos.orchestrator.model.StageStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, read-only copy of the {@link HealthState}, handed to observers
 * and the health endpoint.
 */
public record HealthSnapshot(
        long                   cycleCount,
        String                 lastCycleId,
        Instant                lastSuccessfulCycle,
        boolean                degraded,
        List<String>           circuitBrokenJobs,
        Map<String, Integer>   consecutiveFailures,
        Map<String, StageView> stages) {

    public HealthSnapshot {
        circuitBrokenJobs   = List.copyOf(circuitBrokenJobs);
        consecutiveFailures = Map.copyOf(consecutiveFailures);
        stages              = Map.copyOf(stages);
    }

    public Optional<StageView> stage(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public record StageView(
            String           name,
            StageHealthLevel level,
            StageStatus      lastStatus,
            int              consecutiveFailures,
            long             totalRuns,
            long             totalFailures,
            String           lastError,
            Instant          lastRunAt,
            Instant          lastOutputAt,
            CircuitStatus    circuitStatus,
            int              probeSuccessesSinceOpen,
            Instant          circuitOpenedAt,
            long             circuitOpenedAtCycle) {

        static StageView of(StageHealth s) {
            CircuitState c = s.getCircuit();
            return new StageView(s.getName(), s.level(), s.getLastStatus(),
                    s.getConsecutiveFailures(), s.getTotalRuns(), s.getTotalFailures(),
                    s.getLastError(), s.getLastRunAt(), s.getLastOutputAt(),
                    c.getStatus(), c.getSuccessesSinceOpen(), c.getOpenedAt(), c.getOpenedAtCycle());
        }
    }
}
