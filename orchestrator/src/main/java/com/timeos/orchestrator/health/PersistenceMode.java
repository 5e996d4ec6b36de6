package com.timeos.orchestrator.health;

/** Whether health bookkeeping currently survives a restart. */
public enum PersistenceMode {
    DURABLE,
    IN_MEMORY
}
