package com.timeos.orchestrator.health;

/**
 * Coarse health label for one stage, derived from its consecutive failures.
 */
public enum StageHealthLevel {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /** 0 failures → HEALTHY, 1–2 → DEGRADED, 3 or more → UNHEALTHY. */
    public static StageHealthLevel of(int consecutiveFailures) {
        if (consecutiveFailures == 0) return HEALTHY;
        return consecutiveFailures < 3 ? DEGRADED : UNHEALTHY;
    }
}
