package com.timeos.orchestrator.repository;

import com.timeos.orchestrator.model.CycleRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Cycle history queries for the cycle_runs table.
 */
public interface CycleRunRepository extends JpaRepository<CycleRun, String> {

    /** Newest cycles first; the page size is the limit. */
    List<CycleRun> findAllByOrderByCycleNumberDesc(Pageable page);

    /**
     * Bulk-delete cycles that finished before {@code cutoff} (retention).
     * Must run inside a transaction.
     */
    @Modifying
    @Query("DELETE FROM CycleRun c WHERE c.finishedAt < :cutoff")
    int deleteFinishedBefore(@Param("cutoff") Instant cutoff);
}
