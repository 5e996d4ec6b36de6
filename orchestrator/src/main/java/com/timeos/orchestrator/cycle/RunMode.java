package com.timeos.orchestrator.cycle;

/**
 * LOOP runs cycles forever at the configured interval, ONCE runs a single
 * cycle, OFF starts no cycles (the health endpoints still work).
 */
public enum RunMode {
    LOOP,
    ONCE,
    OFF
}
