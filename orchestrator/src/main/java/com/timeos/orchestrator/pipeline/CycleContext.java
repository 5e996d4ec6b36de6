package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.UpstreamState;

import java.util.Map;

/**
 * Identifies the cycle a pipeline run belongs to.
 *
 * @param cycleId     unique cycle id
 * @param cycleNumber monotonic cycle counter (drives probe scheduling)
 * @param enclosing   upstream map of the enclosing composite stage; empty for
 *                    the top-level pipeline
 */
public record CycleContext(String cycleId, long cycleNumber, Map<String, UpstreamState> enclosing) {

    public CycleContext {
        enclosing = enclosing == null ? Map.of() : Map.copyOf(enclosing);
    }

    public static CycleContext topLevel(String cycleId, long cycleNumber) {
        return new CycleContext(cycleId, cycleNumber, Map.of());
    }
}
