package com.timeos.orchestrator.health;

/**
 * Thrown when the health store cannot load or save the HealthState.
 */
public class HealthPersistenceException extends RuntimeException {

    public HealthPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
