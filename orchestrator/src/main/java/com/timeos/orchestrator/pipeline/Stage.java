package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.StageOutcome;

/**
 * One unit of work in a pipeline.
 *
 * Implementations read their inputs from durable storage, guided by the
 * upstream freshness map in the {@link StageContext}, and write their own
 * output back to storage as a side effect. Only the {@link StageOutcome}
 * metadata flows back to the orchestrator.
 *
 * A stage should catch its own errors and return {@link StageOutcome#failed}.
 * Anything it throws anyway is caught by the {@link JobRunner} and treated the
 * same way.
 */
@FunctionalInterface
public interface Stage {

    StageOutcome execute(StageContext context) throws Exception;
}
