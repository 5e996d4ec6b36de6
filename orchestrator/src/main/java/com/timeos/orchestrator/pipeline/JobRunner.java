package com.timeos.orchestrator.pipeline;

import com.timeos.orchestrator.cycle.OrchestratorBookkeepingException;
import com.timeos.orchestrator.health.CircuitBreaker;
import com.timeos.orchestrator.health.CircuitBreaker.Admission;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.model.StageStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage once per cycle: the single failure boundary every stage
 * goes through.
 *
 * <ol>
 *   <li>Ask the {@link CircuitBreaker}. REJECT returns SKIPPED without running
 *       anything.</li>
 *   <li>Invoke the stage on a worker thread, bounded by its timeout. A thrown
 *       exception, a timeout and a FAILED outcome are all the same thing: a
 *       failed attempt.</li>
 *   <li>On a failed attempt, ask the {@link RetryPolicy}; wait the granted
 *       delay through the cancellable {@link Pause} and try again.</li>
 *   <li>Build the immutable {@link JobResult} and record stage metrics:
 *       <pre>
 *   timeos.stage.duration{stage, status}
 *   timeos.stage.attempts{stage}
 *   timeos.stage.retries{stage}
 *       </pre></li>
 * </ol>
 *
 * Composite stages skip steps 1 and 3 and run on the calling thread, so
 * their sub-pipeline can never outlive them.
 *
 * Probes (circuit OPEN, probe due) run exactly once. A failed probe is
 * reported as SKIPPED with its error kept, so the breaker still sees it.
 *
 * Nothing a stage does escapes this class except
 * {@link OrchestratorBookkeepingException}, which is fatal by contract.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    public static final String CIRCUIT_OPEN_REASON = "circuit open; waiting for next probe";
    public static final String PROBE_FAILED_NOTE   = "circuit open; probe failed";

    private final ExecutorService workers;
    private final RetryPolicy     retryPolicy;
    private final CircuitBreaker  breaker;
    private final Pause           retryPause;
    private final Clock           clock;
    private final MeterRegistry   meterRegistry;
    private final Duration        defaultTimeout;

    public JobRunner(ExecutorService workers,
                     RetryPolicy retryPolicy,
                     CircuitBreaker breaker,
                     Pause retryPause,
                     Clock clock,
                     MeterRegistry meterRegistry,
                     Duration defaultTimeout) {
        this.workers        = workers;
        this.retryPolicy    = retryPolicy;
        this.breaker        = breaker;
        this.retryPause     = retryPause;
        this.clock          = clock;
        this.meterRegistry  = meterRegistry;
        this.defaultTimeout = defaultTimeout;
    }

    public JobResult run(StageSpec spec, StageContext context) {
        String  name      = spec.name();
        Instant startedAt = clock.instant();

        Admission admission = spec.composite() ? Admission.ALLOW : breaker.admit(name, context.cycleNumber());
        if (admission == Admission.REJECT) {
            log.info("Stage '{}' skipped: {}", name, CIRCUIT_OPEN_REASON);
            return JobResult.skipped(name, startedAt, CIRCUIT_OPEN_REASON, context.upstream());
        }

        boolean  probe     = admission == Admission.PROBE;
        boolean  retryable = spec.retryable() && !probe;
        Duration timeout   = spec.timeout() != null ? spec.timeout() : defaultTimeout;
        if (probe) {
            log.info("Stage '{}' circuit is OPEN; running half-open probe", name);
        }

        StageOutcome outcome;
        int attempt = 0;
        while (true) {
            attempt++;
            meterRegistry.counter("timeos.stage.attempts", "stage", name).increment();
            outcome = spec.composite() ? runInline(spec, context) : attemptOnce(spec, context, timeout);
            if (outcome.status() != StageStatus.FAILED) {
                break;
            }
            log.warn("Stage '{}' attempt {} failed: {}", name, attempt, outcome.error());
            if (!retryable) {
                break;
            }
            RetryPolicy.Decision decision = retryPolicy.decide(attempt, outcome.error());
            if (!decision.retry()) {
                break;
            }
            meterRegistry.counter("timeos.stage.retries", "stage", name).increment();
            log.info("Retrying stage '{}' in {}", name, decision.delay());
            if (!retryPause.pause(decision.delay())) {
                log.warn("Retry of stage '{}' abandoned: shutdown requested", name);
                break;
            }
        }

        Duration    duration = Duration.between(startedAt, clock.instant());
        StageStatus status   = outcome.status();
        String      note     = outcome.note();
        if (probe && status == StageStatus.FAILED) {
            status = StageStatus.SKIPPED;
            note   = PROBE_FAILED_NOTE;
        }

        JobResult result = new JobResult(name, status, startedAt, duration, outcome.error(),
                outcome.itemsProcessed(), note, attempt, probe, context.upstream(), outcome.children());

        meterRegistry.timer("timeos.stage.duration", "stage", name, "status", status.name().toLowerCase())
                .record(duration);
        if (status == StageStatus.FAILED) {
            log.warn("Stage '{}' FAILED after {} attempt(s) in {} ms: {}",
                    name, attempt, duration.toMillis(), outcome.error());
        } else {
            log.info("Stage '{}' {} in {} ms ({} items, {} attempt(s))",
                    name, status, duration.toMillis(), outcome.itemsProcessed(), attempt);
        }
        return result;
    }

    /**
     * One bounded invocation. Always returns an outcome; only bookkeeping
     * failures are rethrown.
     */
    private StageOutcome attemptOnce(StageSpec spec, StageContext context, Duration timeout) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<StageOutcome> future;
        try {
            future = workers.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return spec.stage().execute(context);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            return StageOutcome.failed("stage executor rejected '" + spec.name() + "': " + e.getMessage());
        }

        try {
            StageOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome != null ? outcome : StageOutcome.failed("stage returned no outcome");
        } catch (TimeoutException e) {
            future.cancel(true);
            return StageOutcome.failed(new StageTimeoutException(spec.name(), timeout).getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof OrchestratorBookkeepingException fatal) {
                throw fatal;
            }
            log.warn("Stage '{}' raised {}", spec.name(), cause.toString(), cause);
            return StageOutcome.failed(describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StageOutcome.failed("interrupted while waiting for stage '" + spec.name() + "'");
        }
    }

    private StageOutcome runInline(StageSpec spec, StageContext context) {
        try {
            StageOutcome outcome = spec.stage().execute(context);
            return outcome != null ? outcome : StageOutcome.failed("stage returned no outcome");
        } catch (OrchestratorBookkeepingException fatal) {
            throw fatal;
        } catch (Exception e) {
            log.warn("Stage '{}' raised {}", spec.name(), e.toString(), e);
            return StageOutcome.failed(describe(e));
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank()
                ? t.getClass().getSimpleName()
                : t.getClass().getSimpleName() + ": " + message;
    }
}
