package com.timeos.orchestrator.cycle;

import com.timeos.orchestrator.pipeline.Pause;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-way graceful-stop flag. Every wait in the orchestrator (the retry delay
 * and the gap between cycles) goes through {@link #pause}, so a stop request
 * ends them immediately.
 */
public class ShutdownSignal implements Pause {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void requestShutdown() {
        latch.countDown();
    }

    public boolean isShutdownRequested() {
        return latch.getCount() == 0;
    }

    @Override
    public boolean pause(Duration duration) {
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
