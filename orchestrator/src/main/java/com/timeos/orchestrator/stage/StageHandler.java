package com.timeos.orchestrator.stage;

import com.timeos.orchestrator.pipeline.Stage;

/**
 * A stage function contributed as a Spring bean.
 *
 * Declaring an implementation as {@code @Component} is enough to plug it into
 * the cycle: the {@link StageRegistry} picks it up by {@link #stageName()}.
 */
public interface StageHandler extends Stage {

    /** One of the names in {@link StageNames}. */
    String stageName();
}
