package com.timeos.orchestrator.cycle;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ShutdownSignal and the two trigger implementations.
 */
class CycleTriggerTest {

    @Test
    void shutdownSignal_pauseElapsesWhenNotSignalled() {
        ShutdownSignal signal = new ShutdownSignal();

        assertThat(signal.pause(Duration.ofMillis(10))).isTrue();
        assertThat(signal.isShutdownRequested()).isFalse();
    }

    @Test
    void shutdownSignal_cutsPauseShort() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.requestShutdown();

        long start = System.nanoTime();
        assertThat(signal.pause(Duration.ofMinutes(10))).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        assertThat(signal.isShutdownRequested()).isTrue();
    }

    @Test
    void singleShot_firesOnce() {
        SingleShotTrigger trigger = new SingleShotTrigger(new ShutdownSignal());

        assertThat(trigger.awaitNext()).isTrue();
        assertThat(trigger.awaitNext()).isFalse();
    }

    @Test
    void singleShot_neverFiresAfterShutdown() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.requestShutdown();

        assertThat(new SingleShotTrigger(signal).awaitNext()).isFalse();
    }

    @Test
    void interval_firesImmediatelyThenWaits() {
        ShutdownSignal signal = new ShutdownSignal();
        IntervalTrigger trigger = new IntervalTrigger(signal, Duration.ofMillis(20));

        assertThat(trigger.awaitNext()).isTrue();
        assertThat(trigger.awaitNext()).isTrue();

        signal.requestShutdown();
        assertThat(trigger.awaitNext()).isFalse();
    }

    @Test
    void interval_mustBePositive() {
        assertThatThrownBy(() -> new IntervalTrigger(new ShutdownSignal(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
