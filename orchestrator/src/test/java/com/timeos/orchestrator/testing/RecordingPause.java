package com.timeos.orchestrator.testing;

import com.timeos.orchestrator.pipeline.Pause;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Returns immediately and remembers every requested delay. */
public class RecordingPause implements Pause {

    private final List<Duration> requested = new CopyOnWriteArrayList<>();
    private volatile boolean elapses = true;

    /** Make every following pause report that it was cut short. */
    public RecordingPause interrupted() {
        this.elapses = false;
        return this;
    }

    @Override
    public boolean pause(Duration duration) {
        requested.add(duration);
        return elapses;
    }

    public List<Duration> requested() {
        return List.copyOf(requested);
    }
}
