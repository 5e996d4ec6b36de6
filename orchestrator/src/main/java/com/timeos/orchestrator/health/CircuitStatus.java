package com.timeos.orchestrator.health;

/**
 * CLOSED: the stage runs normally.
 * OPEN: the stage is skipped, apart from one half-open probe per probe interval.
 */
public enum CircuitStatus {
    CLOSED,
    OPEN
}
