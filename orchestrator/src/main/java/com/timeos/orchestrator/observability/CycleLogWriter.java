package com.timeos.orchestrator.observability;

import com.timeos.orchestrator.cycle.CycleObserver;
import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.model.CycleResult;
import com.timeos.orchestrator.model.JobResult;
import com.timeos.orchestrator.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the per-cycle report to the log: one summary line, one line per
 * stage (nested stages indented), and the systemic alarms.
 *
 * A degraded cycle and a stuck circuit are reported independently: the first
 * is a WARN about this run, the second an ERROR repeated every cycle until
 * the circuit closes.
 */
public class CycleLogWriter implements CycleObserver {

    private static final Logger log = LoggerFactory.getLogger(CycleLogWriter.class);

    private final int stuckAlarmCycles;

    public CycleLogWriter(int stuckAlarmCycles) {
        this.stuckAlarmCycles = stuckAlarmCycles;
    }

    @Override
    public void onCycleFinished(CycleResult cycle, HealthSnapshot health) {
        log.info("Cycle {} finished in {} ms: phase={} healthy={} succeeded={} failed={} skipped={}",
                cycle.getCycleId(), cycle.getDuration().toMillis(), cycle.getPhase(), cycle.isHealthy(),
                cycle.getSucceededJobs(), cycle.getFailedJobs(), cycle.getSkippedJobs());
        for (JobResult job : cycle.getJobs()) {
            logJob(job, "  ");
        }

        if (!cycle.isHealthy()) {
            log.warn("Cycle {} UNHEALTHY: failed stages {}", cycle.getCycleId(), cycle.getFailedJobs());
        } else if (cycle.isDegradedInput()) {
            log.warn("Cycle {} DEGRADED: at least one stage ran on stale or absent input", cycle.getCycleId());
        }

        if (!health.circuitBrokenJobs().isEmpty()) {
            log.warn("Circuit-broken stages: {}", health.circuitBrokenJobs());
        }
        for (String alarm : stuckCircuits(health, cycle.getCycleNumber())) {
            log.error("STUCK CIRCUIT: {}", alarm);
        }
    }

    /** One message per circuit that has been open for at least the alarm threshold. */
    List<String> stuckCircuits(HealthSnapshot health, long cycleNumber) {
        List<String> alarms = new ArrayList<>();
        for (String stage : health.circuitBrokenJobs()) {
            health.stage(stage).ifPresent(view -> {
                long openFor = cycleNumber - view.circuitOpenedAtCycle();
                if (openFor >= stuckAlarmCycles) {
                    alarms.add("stage '" + stage + "' circuit-broken for " + openFor
                            + " cycles (opened at cycle " + view.circuitOpenedAtCycle()
                            + ", last error: " + view.lastError() + ")");
                }
            });
        }
        return alarms;
    }

    private static void logJob(JobResult job, String indent) {
        String detail = job.error() != null ? "error=" + job.error()
                : job.note() != null ? "note=" + job.note() : "";
        if (job.status() == StageStatus.FAILED) {
            log.warn("{}{} {} items={} attempts={} {}ms {}", indent, job.jobName(), job.status(),
                    job.itemsProcessed(), job.attempts(), job.duration().toMillis(), detail);
        } else {
            log.info("{}{} {} items={} attempts={} {}ms {}", indent, job.jobName(), job.status(),
                    job.itemsProcessed(), job.attempts(), job.duration().toMillis(), detail);
        }
        for (JobResult child : job.children()) {
            logJob(child, indent + "  ");
        }
    }
}
