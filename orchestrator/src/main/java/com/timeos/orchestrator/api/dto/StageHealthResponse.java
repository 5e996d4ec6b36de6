package com.timeos.orchestrator.api.dto;

import com.timeos.orchestrator.health.CircuitStatus;
import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.health.StageHealthLevel;
import com.timeos.orchestrator.model.StageStatus;

import java.time.Instant;

/**
 * Response body for GET /health/stages/{name}.
 */
public record StageHealthResponse(
        String           name,
        StageHealthLevel level,
        StageStatus      lastStatus,
        int              consecutiveFailures,
        long             totalRuns,
        long             totalFailures,
        String           lastError,
        Instant          lastRunAt,
        Instant          lastOutputAt,
        CircuitStatus    circuit,
        int              probeSuccessesSinceOpen,
        Instant          circuitOpenedAt
) {
    public static StageHealthResponse from(HealthSnapshot.StageView view) {
        return new StageHealthResponse(
                view.name(),
                view.level(),
                view.lastStatus(),
                view.consecutiveFailures(),
                view.totalRuns(),
                view.totalFailures(),
                view.lastError(),
                view.lastRunAt(),
                view.lastOutputAt(),
                view.circuitStatus(),
                view.probeSuccessesSinceOpen(),
                view.circuitOpenedAt()
        );
    }
}
