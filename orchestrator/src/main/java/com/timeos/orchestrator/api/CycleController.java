package com.timeos.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.timeos.orchestrator.cycle.CycleOrchestrator;
import com.timeos.orchestrator.model.CycleSummary;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only cycle history.
 *
 * GET /cycles?limit=N      : most recent cycle summaries, newest first
 * GET /cycles/{cycleId}    : one cycle with its full JobResult tree
 */
@RestController
@RequestMapping("/cycles")
public class CycleController {

    static final int MAX_LIMIT = 200;

    private final CycleOrchestrator orchestrator;

    public CycleController(CycleOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<CycleSummary> recent(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        return orchestrator.cycleRecords().recent(limit);
    }

    /**
     * Returns 404 if the cycle is unknown or has been pruned by retention.
     */
    @GetMapping("/{cycleId}")
    public JsonNode cycle(@PathVariable String cycleId) {
        return orchestrator.cycleRecords().find(cycleId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Cycle not found: " + cycleId));
    }
}
