package com.timeos.orchestrator.pipeline;

import java.time.Duration;

/**
 * Stateless retry decision: given the attempt that just failed and its
 * error, should the stage be invoked again, and after what pause?
 *
 * The standard policy grants exactly one retry after a fixed 30-second
 * pause and treats every error the same. Stages that must not be retried
 * opt out through {@link StageSpec#retryable()}, not here.
 */
public final class RetryPolicy {

    public static final int      DEFAULT_MAX_RETRIES = 1;
    public static final Duration DEFAULT_DELAY       = Duration.ofSeconds(30);

    /**
     * @param retry true if another attempt should be made this cycle
     * @param delay pause before that attempt (zero when retry is false)
     */
    public record Decision(boolean retry, Duration delay) {
        static final Decision GIVE_UP = new Decision(false, Duration.ZERO);
    }

    private final int      maxRetries;
    private final Duration delay;

    public RetryPolicy(int maxRetries, Duration delay) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (delay == null || delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
        this.maxRetries = maxRetries;
        this.delay      = delay;
    }

    public static RetryPolicy standard() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_DELAY);
    }

    /**
     * @param attempt 1-indexed number of the attempt that just failed
     * @param error   description of the failure (not used to exempt anything)
     */
    public Decision decide(int attempt, String error) {
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-indexed, got " + attempt);
        return attempt <= maxRetries ? new Decision(true, delay) : Decision.GIVE_UP;
    }

    public int      maxRetries() { return maxRetries; }
    public Duration delay()      { return delay; }
}
