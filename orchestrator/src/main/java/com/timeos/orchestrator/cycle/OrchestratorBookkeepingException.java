package com.timeos.orchestrator.cycle;

/**
 * The orchestrator could not record its own state: a HealthState save or a
 * cycle record append failed.
 *
 * This is the only fatal error class. It propagates out of the job runner,
 * the pipeline and the orchestrator, and halts the run loop.
 */
public class OrchestratorBookkeepingException extends RuntimeException {

    public OrchestratorBookkeepingException(String message, Throwable cause) {
        super(message, cause);
    }
}
