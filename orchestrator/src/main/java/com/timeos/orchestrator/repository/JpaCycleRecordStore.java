package com.timeos.orchestrator.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeos.orchestrator.cycle.CycleRecordStore;
import com.timeos.orchestrator.cycle.OrchestratorBookkeepingException;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.CyclePhase;
import com.timeos.orchestrator.model.CycleRun;
import com.timeos.orchestrator.model.CycleSummary;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Cycle history in the cycle_runs table; each row carries the full
 * CycleResult as JSON.
 */
public class JpaCycleRecordStore implements CycleRecordStore {

    private final CycleRunRepository repo;
    private final ObjectMapper       objectMapper;

    public JpaCycleRecordStore(CycleRunRepository repo, ObjectMapper objectMapper) {
        this.repo         = repo;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void append(CycleResult cycle) {
        try {
            repo.save(new CycleRun(cycle, objectMapper.writeValueAsString(cycle)));
        } catch (JsonProcessingException e) {
            throw new OrchestratorBookkeepingException("Cannot serialise cycle " + cycle.getCycleId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<CycleSummary> recent(int limit) {
        return repo.findAllByOrderByCycleNumberDesc(PageRequest.of(0, limit)).stream()
                .map(JpaCycleRecordStore::toSummary)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JsonNode> find(String cycleId) {
        return repo.findById(cycleId).map(run -> {
            try {
                return objectMapper.readTree(run.getResultJson());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Stored cycle " + cycleId + " is not valid JSON", e);
            }
        });
    }

    @Override
    @Transactional
    public long deleteFinishedBefore(Instant cutoff) {
        return repo.deleteFinishedBefore(cutoff);
    }

    @Override
    public boolean durable() {
        return true;
    }

    static CycleSummary toSummary(CycleRun run) {
        List<String> failed = run.getFailedJobs() == null || run.getFailedJobs().isBlank()
                ? List.of()
                : Arrays.asList(run.getFailedJobs().split(","));
        CyclePhase phase = run.isHealthy() && !run.isDegradedInput() ? CyclePhase.HEALTHY : CyclePhase.DEGRADED;
        return new CycleSummary(run.getCycleId(), run.getCycleNumber(), run.getStartedAt(),
                run.getFinishedAt(), run.isHealthy(), phase, failed);
    }
}
