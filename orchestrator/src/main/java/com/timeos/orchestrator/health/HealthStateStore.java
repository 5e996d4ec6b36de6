package com.timeos.orchestrator.health;

import java.util.Optional;

/**
 * Storage port for the {@link HealthState}. Loaded once at startup, saved
 * after every stage outcome and at the end of every cycle.
 */
public interface HealthStateStore {

    /**
     * @return the last saved state, or empty if nothing has been saved yet
     * @throws HealthPersistenceException if the store cannot be read
     */
    Optional<HealthState> load();

    /** @throws HealthPersistenceException if the state cannot be written */
    void save(HealthState state);

    /** True if saved state survives a process restart. */
    boolean durable();
}
