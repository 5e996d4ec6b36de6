package com.timeos.orchestrator.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.CycleSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Cycle history held in process memory. Used with in-memory health
 * persistence and in tests.
 */
public class InMemoryCycleRecordStore implements CycleRecordStore {

    private final List<CycleResult> cycles = new ArrayList<>();
    private final ObjectMapper      objectMapper;

    public InMemoryCycleRecordStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(CycleResult cycle) {
        cycles.add(cycle);
    }

    @Override
    public synchronized List<CycleSummary> recent(int limit) {
        return cycles.stream()
                .sorted(Comparator.comparingLong(CycleResult::getCycleNumber).reversed())
                .limit(limit)
                .map(CycleSummary::of)
                .toList();
    }

    @Override
    public synchronized Optional<JsonNode> find(String cycleId) {
        return cycles.stream()
                .filter(c -> c.getCycleId().equals(cycleId))
                .findFirst()
                .map(objectMapper::valueToTree);
    }

    @Override
    public synchronized long deleteFinishedBefore(Instant cutoff) {
        int before = cycles.size();
        cycles.removeIf(c -> c.getFinishedAt().isBefore(cutoff));
        return before - cycles.size();
    }

    @Override
    public boolean durable() {
        return false;
    }

    public synchronized List<CycleResult> all() {
        return List.copyOf(cycles);
    }
}
