package com.timeos.orchestrator.cycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.CycleSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of finished cycles.
 */
public interface CycleRecordStore {

    /** Durably append one finished cycle. Failures are fatal to the caller. */
    void append(CycleResult cycle);

    /** Most recent cycles first. */
    List<CycleSummary> recent(int limit);

    /** The full JobResult tree of one cycle, as JSON. */
    Optional<JsonNode> find(String cycleId);

    /** Delete cycles that finished before {@code cutoff}; returns how many. */
    long deleteFinishedBefore(Instant cutoff);

    boolean durable();
}
