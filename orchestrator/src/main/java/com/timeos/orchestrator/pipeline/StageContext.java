package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.model.UpstreamState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a stage is told about the cycle it runs in.
 *
 * The upstream map has one entry per declared dependency. A stage must honour
 * it: FRESH means read this cycle's output, STALE means fall back to the last
 * persisted output, ABSENT means there is nothing to read.
 */
public final class StageContext {

    private final CycleContext               cycle;
    private final String                     stageName;
    private final Map<String, UpstreamState> upstream;
    private final StageHistory               history;

    public StageContext(CycleContext cycle, String stageName,
                        Map<String, UpstreamState> upstream, StageHistory history) {
        this.cycle     = cycle;
        this.stageName = stageName;
        this.upstream  = Collections.unmodifiableMap(new LinkedHashMap<>(upstream));
        this.history   = history;
    }

    public CycleContext cycle()        { return cycle; }
    public String       cycleId()      { return cycle.cycleId(); }
    public long         cycleNumber()  { return cycle.cycleNumber(); }
    public String       stageName()    { return stageName; }

    public Map<String, UpstreamState> upstream() { return upstream; }

    /** Freshness of one declared dependency. */
    public UpstreamState upstream(String dependency) {
        UpstreamState state = upstream.get(dependency);
        if (state == null) {
            throw new IllegalArgumentException(
                    "Stage '" + stageName + "' does not depend on '" + dependency + "'");
        }
        return state;
    }

    /** Upstream map of the composite stage this pipeline runs inside, if any. */
    public Map<String, UpstreamState> enclosing() { return cycle.enclosing(); }

    public boolean allFresh() {
        return upstream.values().stream().allMatch(s -> s == UpstreamState.FRESH);
    }

    public List<String> absentDependencies() {
        return upstream.entrySet().stream()
                .filter(e -> e.getValue() == UpstreamState.ABSENT)
                .map(Map.Entry::getKey)
                .toList();
    }

    /** When {@code stage} last wrote output that downstream stages can fall back to. */
    public Optional<Instant> lastOutputAt(String stage) {
        return history.lastOutputAt(stage);
    }
}
