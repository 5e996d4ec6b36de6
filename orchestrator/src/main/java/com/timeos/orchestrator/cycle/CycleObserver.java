package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.health.HealthSnapshot;
import com.timeos.orchestrator.model.CycleResult;

/**
 * Receives every finished cycle, exactly once, after it has been persisted.
 */
public interface CycleObserver {

    void onCycleFinished(CycleResult cycle, HealthSnapshot health);
}
