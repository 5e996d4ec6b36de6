package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.DegradePolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Static descriptor of a runnable stage. Built once when the pipeline is
 * wired and never changed.
 *
 * @param name          unique stage name (also the health and circuit key)
 * @param stage         the function to run
 * @param dependsOn     stages that must have run (in any status) before this one
 * @param degradePolicy what to do when a dependency is not FRESH
 * @param timeout       wall-clock bound for each attempt; null means the runner default
 * @param retryable     false to skip the retry
 * @param schedule      whether the stage is due this cycle
 * @param composite     the stage runs a sub-pipeline: run inline, never retried,
 *                      no timeout and no circuit of its own
 */
public record StageSpec(
        String        name,
        Stage         stage,
        List<String>  dependsOn,
        DegradePolicy degradePolicy,
        Duration      timeout,
        boolean       retryable,
        StageSchedule schedule,
        boolean       composite) {

    public StageSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(stage, "stage");
        if (name.isBlank()) throw new IllegalArgumentException("stage name must not be blank");
        dependsOn     = List.copyOf(new LinkedHashSet<>(dependsOn == null ? List.of() : dependsOn));
        degradePolicy = degradePolicy == null ? DegradePolicy.RUN_ON_STALE : degradePolicy;
        schedule      = schedule == null ? StageSchedule.EVERY_CYCLE : schedule;
        if (dependsOn.contains(name)) {
            throw new IllegalArgumentException("stage '" + name + "' cannot depend on itself");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive for stage '" + name + "'");
        }
        if (composite && (timeout != null || retryable)) {
            throw new IllegalArgumentException(
                    "composite stage '" + name + "' takes no timeout or retry; its children are bounded");
        }
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String       name;
        private Stage              stage;
        private final List<String> dependsOn = new ArrayList<>();
        private DegradePolicy      degradePolicy = DegradePolicy.RUN_ON_STALE;
        private Duration           timeout;
        private boolean            retryable = true;
        private StageSchedule      schedule = StageSchedule.EVERY_CYCLE;
        private boolean            composite;

        private Builder(String name) { this.name = name; }

        public Builder runs(Stage stage)                   { this.stage = stage; return this; }
        public Builder dependsOn(String... names)          { this.dependsOn.addAll(List.of(names)); return this; }
        public Builder degrade(DegradePolicy policy)       { this.degradePolicy = policy; return this; }
        public Builder timeout(Duration timeout)           { this.timeout = timeout; return this; }
        public Builder noRetry()                           { this.retryable = false; return this; }
        public Builder schedule(StageSchedule schedule)    { this.schedule = schedule; return this; }
        public Builder composite()                         { this.composite = true; this.retryable = false; return this; }

        public StageSpec build() {
            return new StageSpec(name, stage, dependsOn, degradePolicy, timeout, retryable, schedule, composite);
        }
    }
}
