package com.timeos.orchestrator.stage;

import com.timeos.orchestrator.model.StageOutcome;
import com.timeos.orchestrator.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process registry of stage handlers.
 *
 * All {@link StageHandler} beans are collected at startup through constructor
 * injection. A stage name with no handler resolves to a stand-in that reports
 * SKIPPED, so a partial deployment still cycles.
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    public static final String NO_HANDLER_REASON = "no handler registered";

    private final Map<String, StageHandler> handlers = new LinkedHashMap<>();

    public StageRegistry(List<StageHandler> allHandlers) {
        for (StageHandler handler : allHandlers) {
            StageHandler previous = handlers.putIfAbsent(handler.stageName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for stage '" + handler.stageName()
                        + "': " + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
            log.info("Registered stage handler '{}' ({})", handler.stageName(), handler.getClass().getSimpleName());
        }
    }

    /** The handler for {@code name}, or a stand-in that always skips. */
    public Stage resolve(String name) {
        StageHandler handler = handlers.get(name);
        if (handler != null) {
            return handler;
        }
        log.warn("No handler registered for stage '{}'; it will be skipped every cycle", name);
        return context -> StageOutcome.skipped(NO_HANDLER_REASON);
    }

    public boolean has(String name) {
        return handlers.containsKey(name);
    }

    /** Registered stage names (sorted). */
    public List<String> stageNames() {
        return handlers.keySet().stream().sorted().toList();
    }
}
