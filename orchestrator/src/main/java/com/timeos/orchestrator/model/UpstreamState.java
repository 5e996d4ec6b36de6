package com.timeos.orchestrator.model;

/**
 * Freshness of one dependency's output, as seen by a downstream stage.
 *
 * FRESH: the dependency succeeded in this cycle.
 * STALE: the dependency did not succeed this cycle; its last persisted output
 *   must be used instead.
 * ABSENT: the dependency has never produced output. The downstream stage must
 *   report SKIPPED or PARTIAL and must not fabricate data.
 */
public enum UpstreamState {
    FRESH,
    STALE,
    ABSENT
}
