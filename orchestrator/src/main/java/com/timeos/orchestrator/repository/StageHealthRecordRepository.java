package com.timeos.orchestrator.repository;

import com.timeos.orchestrator.model.StageHealthRecord;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the stage_health table, keyed by stage name.
 */
public interface StageHealthRecordRepository extends JpaRepository<StageHealthRecord, String> {
}
