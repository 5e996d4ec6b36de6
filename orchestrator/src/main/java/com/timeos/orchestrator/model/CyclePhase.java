package com.timeos.orchestrator.model;

/**
 * Orchestrator-level state of the current cycle.
 *
 * Transitions:
 *   IDLE → RUNNING → HEALTHY  → IDLE
 *   IDLE → RUNNING → DEGRADED → IDLE
 *
 * DEGRADED is a per-cycle annotation only. Persistent trouble is tracked in
 * the per-stage counters and circuit states of the health record.
 */
public enum CyclePhase {
    IDLE,
    RUNNING,
    HEALTHY,
    DEGRADED
}
