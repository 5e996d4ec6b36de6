package com.timeos.orchestrator.model;

/**
 * Final status of one stage execution within a cycle.
 *
 * SUCCESS: ran and produced its full output.
 * PARTIAL: ran, but produced only some output or worked on stale input.
 * FAILED: raised, timed out, or reported failure (after its retry).
 * SKIPPED: intentionally not run (circuit open, schedule, missing input, shutdown).
 */
public enum StageStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    SKIPPED;

    /** SUCCESS and PARTIAL both mean the stage ran and wrote output. */
    public boolean producedOutput() {
        return this == SUCCESS || this == PARTIAL;
    }
}
