package com.timeos.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timeos.orchestrator.cycle.CycleObserver;
import com.timeos.orchestrator.cycle.CycleOrchestrator;
import com.timeos.orchestrator.cycle.CycleRecordStore;
import com.timeos.orchestrator.cycle.CycleRunLoop;
import com.timeos.orchestrator.cycle.CycleTrigger;
import com.timeos.orchestrator.cycle.InMemoryCycleRecordStore;
import com.timeos.orchestrator.cycle.IntervalTrigger;
import com.timeos.orchestrator.cycle.MaintenanceWindow;
import com.timeos.orchestrator.cycle.RunMode;
import com.timeos.orchestrator.cycle.ShutdownSignal;
import com.timeos.orchestrator.cycle.SingleShotTrigger;
import com.timeos.orchestrator.cycle.TruthCycle;
import com.timeos.orchestrator.health.CircuitBreaker;
import com.timeos.orchestrator.health.HealthLedger;
import com.timeos.orchestrator.health.HealthState;
import com.timeos.orchestrator.health.HealthStateStore;
import com.timeos.orchestrator.health.InMemoryHealthStateStore;
import com.timeos.orchestrator.observability.CycleLogWriter;
import com.timeos.orchestrator.observability.CycleMetrics;
import com.timeos.orchestrator.pipeline.JobRunner;
import com.timeos.orchestrator.pipeline.RetryPolicy;
import com.timeos.orchestrator.pipeline.StagePipeline;
import com.timeos.orchestrator.repository.CycleRunRepository;
import com.timeos.orchestrator.repository.JpaCycleRecordStore;
import com.timeos.orchestrator.repository.JpaHealthStateStore;
import com.timeos.orchestrator.repository.OrchestratorStateRepository;
import com.timeos.orchestrator.repository.StageHealthRecordRepository;
import com.timeos.orchestrator.stage.CycleHistoryRetentionStage;
import com.timeos.orchestrator.stage.StageHandler;
import com.timeos.orchestrator.stage.StageNames;
import com.timeos.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestrator: health bookkeeping, the job runner, the truth
 * sub-pipeline, the top-level pipeline and the run loop.
 *
 * Stage functions are not wired here: any {@link StageHandler} bean is picked
 * up by the {@link StageRegistry}.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    /**
     * Stage attempts run here so the run loop can enforce timeouts. Cached,
     * so a worker abandoned after a timeout never holds up the next stage.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("stage-worker-"));
    }

    // ------------------------------------------------------------------
    // Health bookkeeping
    // ------------------------------------------------------------------

    @Bean
    public HealthState healthState() {
        return new HealthState();
    }

    @Bean
    public CircuitBreaker circuitBreaker(HealthState healthState, OrchestratorProperties props) {
        OrchestratorProperties.Circuit c = props.getCircuit();
        return new CircuitBreaker(healthState, c.getOpenThreshold(), c.getResetThreshold(), c.getProbeEveryCycles());
    }

    @Bean
    public HealthStateStore healthStateStore(OrchestratorProperties props,
                                             StageHealthRecordRepository stageRepo,
                                             OrchestratorStateRepository stateRepo,
                                             PlatformTransactionManager txManager,
                                             Clock clock) {
        if (props.getHealth().getPersistence() == OrchestratorProperties.Health.Persistence.MEMORY) {
            return new InMemoryHealthStateStore();
        }
        return new JpaHealthStateStore(stageRepo, stateRepo, txManager, clock);
    }

    @Bean
    public CycleRecordStore cycleRecordStore(OrchestratorProperties props,
                                             CycleRunRepository repo,
                                             ObjectMapper objectMapper) {
        if (props.getHealth().getPersistence() == OrchestratorProperties.Health.Persistence.MEMORY) {
            return new InMemoryCycleRecordStore(objectMapper);
        }
        return new JpaCycleRecordStore(repo, objectMapper);
    }

    @Bean
    public HealthLedger healthLedger(HealthState healthState,
                                     CircuitBreaker circuitBreaker,
                                     HealthStateStore healthStateStore,
                                     OrchestratorProperties props) {
        return new HealthLedger(healthState, circuitBreaker, healthStateStore,
                props.getHealth().isFallbackToMemory());
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    @Bean
    public CycleHistoryRetentionStage cycleHistoryRetentionStage(CycleRecordStore cycleRecordStore,
                                                                 OrchestratorProperties props,
                                                                 Clock clock) {
        return new CycleHistoryRetentionStage(cycleRecordStore, props.getRetention().getCycleHistory(), clock);
    }

    @Bean
    public StageRegistry stageRegistry(List<StageHandler> handlers) {
        return new StageRegistry(handlers);
    }

    @Bean
    public RetryPolicy retryPolicy(OrchestratorProperties props) {
        return new RetryPolicy(props.getRetry().getMaxRetries(), props.getRetry().getDelay());
    }

    @Bean
    public JobRunner jobRunner(ExecutorService stageExecutor,
                               RetryPolicy retryPolicy,
                               CircuitBreaker circuitBreaker,
                               ShutdownSignal shutdownSignal,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               OrchestratorProperties props) {
        return new JobRunner(stageExecutor, retryPolicy, circuitBreaker, shutdownSignal,
                clock, meterRegistry, props.getStageTimeout());
    }

    @Bean
    public TruthCycle truthCycle(StageRegistry registry,
                                 JobRunner jobRunner,
                                 HealthLedger healthLedger,
                                 ShutdownSignal shutdownSignal,
                                 OrchestratorProperties props,
                                 Clock clock) {
        StagePipeline inner = new StagePipeline(StageNames.TRUTH,
                TruthCycle.stageSpecs(registry, props::timeoutFor),
                jobRunner, healthLedger, shutdownSignal::isShutdownRequested, clock);
        return new TruthCycle(inner);
    }

    @Bean
    public MaintenanceWindow maintenanceWindow(OrchestratorProperties props) {
        OrchestratorProperties.Maintenance m = props.getMaintenance();
        return new MaintenanceWindow(m.getZone(), m.getStartHour(), m.getEndHour());
    }

    // ------------------------------------------------------------------
    // Observers
    // ------------------------------------------------------------------

    @Bean
    public CycleLogWriter cycleLogWriter(OrchestratorProperties props) {
        return new CycleLogWriter(props.getCircuit().getStuckAlarmCycles());
    }

    @Bean
    public CycleMetrics cycleMetrics(Clock clock) {
        return new CycleMetrics(clock);
    }

    // ------------------------------------------------------------------
    // Orchestrator + run loop
    // ------------------------------------------------------------------

    @Bean
    public CycleOrchestrator cycleOrchestrator(StageRegistry registry,
                                               TruthCycle truthCycle,
                                               MaintenanceWindow maintenanceWindow,
                                               JobRunner jobRunner,
                                               HealthLedger healthLedger,
                                               CycleRecordStore cycleRecordStore,
                                               List<CycleObserver> observers,
                                               ShutdownSignal shutdownSignal,
                                               OrchestratorProperties props,
                                               Clock clock) {
        StagePipeline pipeline = new StagePipeline("cycle",
                CycleOrchestrator.stageSpecs(registry, truthCycle, maintenanceWindow, props::timeoutFor),
                jobRunner, healthLedger, shutdownSignal::isShutdownRequested, clock);
        return new CycleOrchestrator(pipeline, healthLedger, cycleRecordStore, observers, clock);
    }

    @Bean
    public CycleTrigger cycleTrigger(ShutdownSignal shutdownSignal, OrchestratorProperties props) {
        return props.getMode() == RunMode.ONCE
                ? new SingleShotTrigger(shutdownSignal)
                : new IntervalTrigger(shutdownSignal, props.getCycleInterval());
    }

    @Bean
    public CycleRunLoop cycleRunLoop(CycleOrchestrator cycleOrchestrator,
                                     CycleTrigger cycleTrigger,
                                     ShutdownSignal shutdownSignal,
                                     OrchestratorProperties props) {
        return new CycleRunLoop(cycleOrchestrator, cycleTrigger, shutdownSignal,
                props.getMode(), props.getShutdownTimeout());
    }
}
