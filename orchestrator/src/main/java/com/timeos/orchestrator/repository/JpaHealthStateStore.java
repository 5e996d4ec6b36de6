package com.timeos.orchestrator.repository;

import com.timeos.orchestrator.health.CircuitState;
import com.timeos.orchestrator.health.HealthPersistenceException;
import com.timeos.orchestrator.health.HealthState;
import com.timeos.orchestrator.health.HealthStateStore;
import com.timeos.orchestrator.health.StageHealth;
import com.timeos.orchestrator.model.OrchestratorStateRecord;
import com.timeos.orchestrator.model.StageHealthRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * HealthState persisted in PostgreSQL (stage_health + orchestrator_state).
 *
 * Each save writes the whole state in one transaction, so a crash never
 * leaves counters and circuits half-updated. The transaction is run through
 * a {@link TransactionTemplate} so commit failures are caught here as well.
 */
public class JpaHealthStateStore implements HealthStateStore {

    private final StageHealthRecordRepository stageRepo;
    private final OrchestratorStateRepository stateRepo;
    private final TransactionTemplate         tx;
    private final Clock                       clock;

    public JpaHealthStateStore(StageHealthRecordRepository stageRepo,
                               OrchestratorStateRepository stateRepo,
                               PlatformTransactionManager txManager,
                               Clock clock) {
        this.stageRepo = stageRepo;
        this.stateRepo = stateRepo;
        this.tx        = new TransactionTemplate(txManager);
        this.clock     = clock;
    }

    @Override
    public Optional<HealthState> load() {
        try {
            return tx.execute(status -> {
                Optional<OrchestratorStateRecord> row    = stateRepo.findById(OrchestratorStateRecord.SINGLETON_ID);
                List<StageHealthRecord>           stages = stageRepo.findAll();
                if (row.isEmpty() && stages.isEmpty()) {
                    return Optional.<HealthState>empty();
                }
                OrchestratorStateRecord cycle = row.orElseGet(OrchestratorStateRecord::new);
                return Optional.of(HealthState.restore(
                        cycle.getCycleCount(),
                        cycle.getLastCycleId(),
                        cycle.getLastSuccessfulCycle(),
                        cycle.isDegraded(),
                        stages.stream().map(JpaHealthStateStore::toStageHealth).toList()));
            });
        } catch (DataAccessException | TransactionException e) {
            throw new HealthPersistenceException("Cannot load health state: " + e.getMessage(), e);
        }
    }

    @Override
    public void save(HealthState state) {
        HealthState copy = state.copy();
        Instant now = clock.instant();
        try {
            tx.executeWithoutResult(status -> {
                OrchestratorStateRecord row = stateRepo.findById(OrchestratorStateRecord.SINGLETON_ID)
                        .orElseGet(OrchestratorStateRecord::new);
                row.setCycleCount(copy.getCycleCount());
                row.setLastCycleId(copy.getLastCycleId());
                row.setLastSuccessfulCycle(copy.getLastSuccessfulCycle());
                row.setDegraded(copy.isDegraded());
                row.setUpdatedAt(now);
                stateRepo.save(row);

                Map<String, StageHealthRecord> existing = stageRepo.findAll().stream()
                        .collect(Collectors.toMap(StageHealthRecord::getStageName, Function.identity()));
                for (StageHealth health : copy.stages()) {
                    StageHealthRecord record = existing.getOrDefault(health.getName(),
                            new StageHealthRecord(health.getName()));
                    apply(health, record);
                    record.setUpdatedAt(now);
                    stageRepo.save(record);
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new HealthPersistenceException("Cannot save health state: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean durable() {
        return true;
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    static StageHealth toStageHealth(StageHealthRecord r) {
        CircuitState circuit = CircuitState.restore(r.getCircuitStatus(), r.getConsecutiveFailures(),
                r.getSuccessesSinceOpen(), r.getCircuitOpenedAt(), r.getCircuitOpenedAtCycle(),
                r.getLastProbeCycle());
        return StageHealth.restore(r.getStageName(), circuit, r.getTotalRuns(), r.getTotalFailures(),
                r.getLastRunAt(), r.getLastOutputAt(), r.getLastError(), r.getLastStatus());
    }

    static void apply(StageHealth h, StageHealthRecord r) {
        CircuitState c = h.getCircuit();
        r.setCircuitStatus(c.getStatus());
        r.setConsecutiveFailures(c.getConsecutiveFailures());
        r.setSuccessesSinceOpen(c.getSuccessesSinceOpen());
        r.setCircuitOpenedAt(c.getOpenedAt());
        r.setCircuitOpenedAtCycle(c.getOpenedAtCycle());
        r.setLastProbeCycle(c.getLastProbeCycle());
        r.setTotalRuns(h.getTotalRuns());
        r.setTotalFailures(h.getTotalFailures());
        r.setLastRunAt(h.getLastRunAt());
        r.setLastOutputAt(h.getLastOutputAt());
        r.setLastError(h.getLastError());
        r.setLastStatus(h.getLastStatus());
    }
}
