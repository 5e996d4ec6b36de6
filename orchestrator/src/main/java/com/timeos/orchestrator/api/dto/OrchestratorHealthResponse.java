package com.timeos.orchestrator.api.dto;

import com.timeos.orchestrator.cycle.CycleRunLoop;
import com.timeos.orchestrator.cycle.RunMode;
import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.health.PersistenceMode;
import com.timeos.orchestrator.model.CyclePhase;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response body for GET /health/orchestrator.
 *
 * circuitBrokenJobs (systemic) and lastCyclePhase (per run) are reported side
 * by side; either can be bad while the other is fine.
 */
public record OrchestratorHealthResponse(
        CyclePhase              phase,
        CyclePhase              lastCyclePhase,
        CycleRunLoop.LoopStatus loopStatus,
        RunMode                 runMode,
        PersistenceMode         persistenceMode,
        long                    cycleCount,
        String                  lastCycleId,
        Instant                 lastSuccessfulCycle,
        boolean                 degraded,
        List<String>            circuitBrokenJobs,
        Map<String, Integer>    consecutiveFailures
) {
    public static OrchestratorHealthResponse from(HealthSnapshot health,
                                                  CyclePhase phase,
                                                  CyclePhase lastCyclePhase,
                                                  CycleRunLoop.LoopStatus loopStatus,
                                                  RunMode runMode,
                                                  PersistenceMode persistenceMode) {
        return new OrchestratorHealthResponse(
                phase,
                lastCyclePhase,
                loopStatus,
                runMode,
                persistenceMode,
                health.cycleCount(),
                health.lastCycleId(),
                health.lastSuccessfulCycle(),
                health.degraded(),
                health.circuitBrokenJobs(),
                health.consecutiveFailures()
        );
    }
}
