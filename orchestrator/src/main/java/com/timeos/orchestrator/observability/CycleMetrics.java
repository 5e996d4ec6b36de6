package com.timeos.orchestrator.observability;

import com.timeos.orchestrator.cycle.CycleObserver;
import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.model.CycleResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cycle-level Micrometer metrics, refreshed after every cycle:
 * <pre>
 *   timeos.cycles{healthy}                         counter
 *   timeos.cycle.duration                          timer
 *   timeos.circuits.open                           gauge
 *   timeos.stage.consecutive_failures{stage}       gauge
 *   timeos.cycle.last_success_age_seconds          gauge (NaN before the first healthy cycle)
 * </pre>
 * Stage-level timers and counters are recorded by the job runner.
 */
public class CycleMetrics implements CycleObserver, MeterBinder {

    private final Clock clock;

    private final AtomicInteger              openCircuits        = new AtomicInteger();
    private final AtomicReference<Instant>   lastSuccess         = new AtomicReference<>();
    private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

    private volatile MeterRegistry registry;

    public CycleMetrics(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("timeos.circuits.open", openCircuits, AtomicInteger::get)
                .description("Stages whose circuit is currently open")
                .register(registry);
        Gauge.builder("timeos.cycle.last_success_age_seconds", lastSuccess, this::ageSeconds)
                .description("Seconds since the last healthy cycle finished")
                .register(registry);
        consecutiveFailures.forEach((stage, value) -> registerStageGauge(registry, stage, value));
    }

    @Override
    public void onCycleFinished(CycleResult cycle, HealthSnapshot health) {
        MeterRegistry meters = registry;
        if (meters != null) {
            meters.counter("timeos.cycles", "healthy", Boolean.toString(cycle.isHealthy())).increment();
            meters.timer("timeos.cycle.duration").record(cycle.getDuration());
        }

        openCircuits.set(health.circuitBrokenJobs().size());
        lastSuccess.set(health.lastSuccessfulCycle());
        health.consecutiveFailures().forEach((stage, count) ->
                consecutiveFailures.computeIfAbsent(stage, name -> {
                    AtomicInteger value = new AtomicInteger();
                    if (meters != null) registerStageGauge(meters, name, value);
                    return value;
                }).set(count));
    }

    private double ageSeconds(AtomicReference<Instant> ref) {
        Instant at = ref.get();
        return at == null ? Double.NaN : Duration.between(at, clock.instant()).toMillis() / 1000.0;
    }

    private static void registerStageGauge(MeterRegistry registry, String stage, AtomicInteger value) {
        Gauge.builder("timeos.stage.consecutive_failures", value, AtomicInteger::get)
                .tag("stage", stage)
                .register(registry);
    }
}
