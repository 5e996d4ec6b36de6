package com.timeos.orchestrator.repository;

import com.timeos.orchestrator.model.OrchestratorStateRecord;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Access to the singleton orchestrator_state row.
 */
public interface OrchestratorStateRepository extends JpaRepository<OrchestratorStateRecord, Integer> {
}
