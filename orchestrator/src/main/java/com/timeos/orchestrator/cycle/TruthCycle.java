package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.model.DegradePolicy;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.pipeline.CycleContext;
import com.timeos.orchestrator.pipeline.Stage;
import com.timeos.orchestrator.pipeline.StageContext;
import com.timeos.orchestrator.pipeline.StagePipeline;
import com.timeos.orchestrator.pipeline.StageSpec;
import com.timeos.orchestrator.stage.StageRegistry;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.timeos.orchestrator.stage.StageNames.CAPACITY;
import static com.timeos.orchestrator.stage.StageNames.CLIENT_HEALTH;
import static com.timeos.orchestrator.stage.StageNames.COMMITMENT;
import static com.timeos.orchestrator.stage.StageNames.TIME;

/**
 * The truth sub-pipeline (time, commitment, capacity, client-health) exposed
 * to the outer cycle as one composite stage.
 *
 * <pre>
 *   time ──────────┬──> capacity ──┐
 *                  │               ├──> client-health
 *   commitment ────┴───────────────┘
 * </pre>
 *
 * The composite status is derived from all four children; every child
 * result is kept in {@link JobResult#children()}. The composite runs on the
 * caller's thread with no timeout or circuit of its own; each child is
 * bounded individually by the {@link com.timeos.orchestrator.pipeline.JobRunner}.
 */
public class TruthCycle implements Stage {

    private final StagePipeline pipeline;

    public TruthCycle(StagePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * The four truth stages in their fixed order.
     *
     * @param timeouts per-stage timeout, or null for the runner default
     */
    public static List<StageSpec> stageSpecs(StageRegistry registry, Function<String, Duration> timeouts) {
        return List.of(
                StageSpec.named(TIME)
                        .runs(registry.resolve(TIME))
                        .timeout(timeouts.apply(TIME))
                        .build(),
                StageSpec.named(COMMITMENT)
                        .runs(registry.resolve(COMMITMENT))
                        .timeout(timeouts.apply(COMMITMENT))
                        .build(),
                StageSpec.named(CAPACITY)
                        .runs(registry.resolve(CAPACITY))
                        .dependsOn(TIME)
                        .degrade(DegradePolicy.SKIP_WHEN_ABSENT)
                        .timeout(timeouts.apply(CAPACITY))
                        .build(),
                StageSpec.named(CLIENT_HEALTH)
                        .runs(registry.resolve(CLIENT_HEALTH))
                        .dependsOn(TIME, COMMITMENT, CAPACITY)
                        .degrade(DegradePolicy.SKIP_WHEN_ABSENT)
                        .timeout(timeouts.apply(CLIENT_HEALTH))
                        .build());
    }

    @Override
    public StageOutcome execute(StageContext context) {
        CycleContext inner = new CycleContext(context.cycleId(), context.cycleNumber(), context.upstream());
        return compose(pipeline.run(inner));
    }

    /**
     * Derive the composite outcome. A skipped child counts as degraded:
     * <ul>
     *   <li>nothing ran: SKIPPED</li>
     *   <li>every child succeeded: SUCCESS</li>
     *   <li>at least one child succeeded or was partial: PARTIAL</li>
     *   <li>otherwise (failures, possibly with skips): FAILED</li>
     * </ul>
     */
    public static StageOutcome compose(List<JobResult> children) {
        long items = children.stream().mapToLong(JobResult::itemsProcessed).sum();
        List<JobResult> ran = children.stream()
                .filter(c -> c.status() != StageStatus.SKIPPED)
                .toList();

        StageOutcome outcome;
        if (ran.isEmpty()) {
            outcome = StageOutcome.skipped("all truth stages skipped");
        } else if (children.stream().allMatch(c -> c.status() == StageStatus.SUCCESS)) {
            outcome = StageOutcome.success(items);
        } else if (ran.stream().anyMatch(c -> c.status().producedOutput())) {
            outcome = StageOutcome.partial(items, summary(children));
        } else {
            outcome = StageOutcome.failed("all truth stages failed: " + names(ran));
        }
        return outcome.withChildren(children);
    }

    private static String summary(List<JobResult> children) {
        return children.stream()
                .filter(c -> c.status() != StageStatus.SUCCESS)
                .map(c -> c.jobName() + "=" + c.status().name().toLowerCase())
                .collect(Collectors.joining(", "));
    }

    private static String names(List<JobResult> results) {
        return results.stream().map(JobResult::jobName).collect(Collectors.joining(", "));
    }
}
