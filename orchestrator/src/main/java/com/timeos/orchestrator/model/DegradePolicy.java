package com.timeos.orchestrator.model;

/**
 * What a stage does when one of its dependencies is not FRESH.
 */
public enum DegradePolicy {

    /** Run on the last-known-good output; the stage itself handles ABSENT inputs. */
    RUN_ON_STALE,

    /** Run on stale input, but skip without running if any dependency is ABSENT. */
    SKIP_WHEN_ABSENT,

    /** Skip without running unless every dependency is FRESH. */
    SKIP_WHEN_STALE
}
