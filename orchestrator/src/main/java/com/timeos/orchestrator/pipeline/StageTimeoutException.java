package com.timeos.orchestrator.pipeline;

import java.time.Duration;

/**
 * Raised inside the job runner when a stage attempt exceeds its timeout.
 * Converted to a FAILED outcome there; it never leaves the runner.
 */
public class StageTimeoutException extends RuntimeException {

    public StageTimeoutException(String stage, Duration timeout) {
        super("Stage '" + stage + "' timed out after " + timeout);
    }
}
