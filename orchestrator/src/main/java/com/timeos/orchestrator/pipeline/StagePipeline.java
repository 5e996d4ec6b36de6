package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageStatus;
import com.timeos.orchestrator.model.UpstreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * An ordered set of stages with declared dependencies, run one after
 * another through the {@link JobRunner}.
 *
 * <p>The pipeline never aborts on a stage outcome. Before each stage it
 * computes the stage's upstream map:
 * <ul>
 *   <li>FRESH: the dependency returned SUCCESS this cycle</li>
 *   <li>STALE: it did not, but it has produced output in some earlier run</li>
 *   <li>ABSENT: it has never produced output</li>
 * </ul>
 * and applies the stage's {@link com.timeos.orchestrator.model.DegradePolicy}.
 * A stage that reports SUCCESS on non-fresh input is recorded as PARTIAL.
 *
 * <p>Each outcome is handed to the {@link StageHistory} before the next
 * stage starts, so freshness and health are always current. Once shutdown
 * is requested or the running thread is interrupted, the remaining stages
 * are recorded as SKIPPED without running.
 */
public class StagePipeline {

    private static final Logger log = LoggerFactory.getLogger(StagePipeline.class);

    public static final String SHUTDOWN_REASON      = "shutdown requested";
    public static final String NOT_SCHEDULED_REASON = "not scheduled this cycle";

    private final String          name;
    private final List<StageSpec> ordered;
    private final JobRunner       runner;
    private final StageHistory    history;
    private final BooleanSupplier shutdownRequested;
    private final Clock           clock;

    public StagePipeline(String name,
                         List<StageSpec> stages,
                         JobRunner runner,
                         StageHistory history,
                         BooleanSupplier shutdownRequested,
                         Clock clock) {
        this.name              = name;
        this.ordered           = topologicalOrder(name, stages);
        this.runner            = runner;
        this.history           = history;
        this.shutdownRequested = shutdownRequested;
        this.clock             = clock;
    }

    public String name() { return name; }

    /** Stage names in execution order. */
    public List<String> stageNames() {
        return ordered.stream().map(StageSpec::name).toList();
    }

    /**
     * Run every stage once, in dependency order.
     *
     * @return one result per stage, in execution order
     * @throws com.timeos.orchestrator.cycle.OrchestratorBookkeepingException
     *         if an outcome cannot be recorded
     */
    public List<JobResult> run(CycleContext cycle) {
        Map<String, JobResult> thisCycle = new HashMap<>();
        List<JobResult>        results   = new ArrayList<>(ordered.size());

        for (StageSpec spec : ordered) {
            Map<String, UpstreamState> upstream = upstreamFor(spec, thisCycle);
            JobResult result = runOrSkip(spec, cycle, upstream);
            if (spec.composite()) {
                history.recordComposite(cycle, result);
            } else {
                history.record(cycle, result);
            }
            thisCycle.put(spec.name(), result);
            results.add(result);
        }
        return results;
    }

    private JobResult runOrSkip(StageSpec spec, CycleContext cycle, Map<String, UpstreamState> upstream) {
        Instant now = clock.instant();

        if (shutdownRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            log.info("Stage '{}' skipped: {}", spec.name(), SHUTDOWN_REASON);
            return JobResult.skipped(spec.name(), now, SHUTDOWN_REASON, upstream);
        }
        if (!spec.schedule().isDue(now, history.lastRunAt(spec.name()))) {
            log.debug("Stage '{}' skipped: {}", spec.name(), NOT_SCHEDULED_REASON);
            return JobResult.skipped(spec.name(), now, NOT_SCHEDULED_REASON, upstream);
        }
        Optional<String> degradeSkip = degradeSkipReason(spec, upstream);
        if (degradeSkip.isPresent()) {
            log.warn("Stage '{}' skipped: {}", spec.name(), degradeSkip.get());
            return JobResult.skipped(spec.name(), now, degradeSkip.get(), upstream);
        }

        String previousStage = MDC.get("stage");
        MDC.put("stage", spec.name());
        try {
            JobResult result = runner.run(spec, new StageContext(cycle, spec.name(), upstream, history));
            return downgradeIfStale(result, upstream);
        } finally {
            if (previousStage == null) MDC.remove("stage");
            else MDC.put("stage", previousStage);
        }
    }

    private Map<String, UpstreamState> upstreamFor(StageSpec spec, Map<String, JobResult> thisCycle) {
        Map<String, UpstreamState> upstream = new LinkedHashMap<>();
        for (String dep : spec.dependsOn()) {
            JobResult ran = thisCycle.get(dep);
            if (ran != null && ran.status() == StageStatus.SUCCESS) {
                upstream.put(dep, UpstreamState.FRESH);
            } else if (history.lastOutputAt(dep).isPresent()) {
                upstream.put(dep, UpstreamState.STALE);
            } else {
                upstream.put(dep, UpstreamState.ABSENT);
            }
        }
        return upstream;
    }

    static Optional<String> degradeSkipReason(StageSpec spec, Map<String, UpstreamState> upstream) {
        return switch (spec.degradePolicy()) {
            case RUN_ON_STALE -> Optional.empty();
            case SKIP_WHEN_ABSENT -> {
                List<String> absent = dependenciesIn(upstream, UpstreamState.ABSENT);
                yield absent.isEmpty()
                        ? Optional.empty()
                        : Optional.of("no data: " + String.join(", ", absent) + " never produced output");
            }
            case SKIP_WHEN_STALE -> {
                List<String> notFresh = upstream.entrySet().stream()
                        .filter(e -> e.getValue() != UpstreamState.FRESH)
                        .map(Map.Entry::getKey)
                        .toList();
                yield notFresh.isEmpty()
                        ? Optional.empty()
                        : Optional.of("upstream not fresh: " + String.join(", ", notFresh));
            }
        };
    }

    private static JobResult downgradeIfStale(JobResult result, Map<String, UpstreamState> upstream) {
        if (result.status() != StageStatus.SUCCESS) {
            return result;
        }
        String degraded = upstream.entrySet().stream()
                .filter(e -> e.getValue() != UpstreamState.FRESH)
                .map(e -> e.getKey() + "=" + describe(e.getValue()))
                .collect(Collectors.joining(", "));
        if (degraded.isEmpty()) {
            return result;
        }
        String note = "ran on degraded input: " + degraded;
        if (result.note() != null && !result.note().isBlank()) {
            note = result.note() + "; " + note;
        }
        log.warn("Stage '{}' downgraded to PARTIAL: {}", result.jobName(), note);
        return new JobResult(result.jobName(), StageStatus.PARTIAL, result.startedAt(), result.duration(),
                result.error(), result.itemsProcessed(), note, result.attempts(), result.probe(),
                result.upstream(), result.children());
    }

    private static String describe(UpstreamState state) {
        return switch (state) {
            case FRESH  -> "fresh";
            case STALE  -> "stale (last-known-good)";
            case ABSENT -> "absent";
        };
    }

    private static List<String> dependenciesIn(Map<String, UpstreamState> upstream, UpstreamState wanted) {
        return upstream.entrySet().stream()
                .filter(e -> e.getValue() == wanted)
                .map(Map.Entry::getKey)
                .toList();
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    /**
     * Stable topological sort: among the stages whose dependencies are
     * satisfied, the one declared first runs first.
     */
    static List<StageSpec> topologicalOrder(String pipeline, List<StageSpec> stages) {
        Map<String, StageSpec> byName = new LinkedHashMap<>();
        for (StageSpec spec : stages) {
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalArgumentException(
                        "Pipeline '" + pipeline + "' declares stage '" + spec.name() + "' twice");
            }
        }
        for (StageSpec spec : stages) {
            for (String dep : spec.dependsOn()) {
                if (!byName.containsKey(dep)) {
                    throw new IllegalArgumentException("Stage '" + spec.name() + "' in pipeline '"
                            + pipeline + "' depends on unknown stage '" + dep + "'");
                }
            }
        }

        List<StageSpec> order  = new ArrayList<>(stages.size());
        Set<String>     placed = new HashSet<>();
        while (order.size() < stages.size()) {
            StageSpec next = null;
            for (StageSpec spec : stages) {
                if (!placed.contains(spec.name()) && placed.containsAll(spec.dependsOn())) {
                    next = spec;
                    break;
                }
            }
            if (next == null) {
                List<String> stuck = stages.stream().map(StageSpec::name)
                        .filter(n -> !placed.contains(n)).toList();
                throw new IllegalArgumentException(
                        "Pipeline '" + pipeline + "' has a dependency cycle among " + stuck);
            }
            order.add(next);
            placed.add(next.name());
        }
        return List.copyOf(order);
    }
}
