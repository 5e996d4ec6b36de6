package com.timeos.orchestrator.health;

import java.util.Optional;

/**
 * Keeps the last saved HealthState in process memory. Everything is lost on
 * restart; used for {@code orchestrator.health.persistence=memory}, as the
 * fallback when the durable store is unavailable, and in tests.
 */
public class InMemoryHealthStateStore implements HealthStateStore {

    private HealthState saved;

    @Override
    public synchronized Optional<HealthState> load() {
        return Optional.ofNullable(saved).map(HealthState::copy);
    }

    @Override
    public synchronized void save(HealthState state) {
        this.saved = state.copy();
    }

    @Override
    public boolean durable() {
        return false;
    }
}
