package com.timeos.orchestrator.api;

import com.timeos.orchestrator.api.dto.OrchestratorHealthResponse;
import com.timeos.orchestrator.api.dto.StageHealthResponse;
import com.timeos.orchestrator.cycle.CycleOrchestrator;
import com.timeos.orchestrator.cycle.CycleRunLoop;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Read-only view of orchestrator health.
 *
 * GET /health/orchestrator     : health state, circuits, phase and loop status
 * GET /health/stages/{name}    : one stage's health record
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final CycleOrchestrator orchestrator;
    private final CycleRunLoop      runLoop;

    public HealthController(CycleOrchestrator orchestrator, CycleRunLoop runLoop) {
        this.orchestrator = orchestrator;
        this.runLoop      = runLoop;
    }

    @GetMapping("/orchestrator")
    public OrchestratorHealthResponse orchestrator() {
        return OrchestratorHealthResponse.from(
                orchestrator.healthSnapshot(),
                orchestrator.phase(),
                orchestrator.lastPhase().orElse(null),
                runLoop.status(),
                runLoop.mode(),
                orchestrator.persistenceMode());
    }

    /**
     * Returns 404 if the stage has never been recorded.
     */
    @GetMapping("/stages/{name}")
    public StageHealthResponse stage(@PathVariable String name) {
        return orchestrator.healthSnapshot().stage(name)
                .map(StageHealthResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Stage not found: " + name));
    }
}
