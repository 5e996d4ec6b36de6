package com.timeos.orchestrator.health;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthStateTest {

    static final Instant T0 = Instant.parse("2026-10-18T12:00:00Z");

    @Test
    void stages_returnsCopiesDetachedFromLaterUpdates() {
        HealthState state = new HealthState();
        CircuitBreaker breaker = new CircuitBreaker(state);
        breaker.recordFailure("collect", 1, T0);

        List<StageHealth> before = state.stages();
        breaker.recordFailure("collect", 2, T0);
        breaker.recordFailure("collect", 3, T0);

        assertThat(before).hasSize(1);
        assertThat(before.get(0).getConsecutiveFailures()).isEqualTo(1);
        assertThat(before.get(0).getCircuit().isOpen()).isFalse();
        assertThat(state.stages().get(0).getCircuit().isOpen()).isTrue();
    }

    @Test
    void snapshot_isNotAffectedByLaterUpdates() {
        HealthState state = new HealthState();
        CircuitBreaker breaker = new CircuitBreaker(state);
        breaker.recordFailure("collect", 1, T0);

        HealthSnapshot snapshot = state.snapshot();
        breaker.recordSuccess("collect");

        assertThat(snapshot.consecutiveFailures()).containsEntry("collect", 1);
        assertThat(state.snapshot().consecutiveFailures()).containsEntry("collect", 0);
    }
}
