package com.timeos.orchestrator.config;

import com.timeos.orchestrator.cycle.RunMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orchestrator settings, bound from {@code orchestrator.*}.
 *
 * <p>Every field has a default, so an empty configuration gives the standard
 * behaviour: a cycle every 15 minutes, one retry after 30 s, circuits opening
 * after 3 failed cycles and closing after 5 good probes.
 */
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /** loop (default), once or off. */
    private RunMode mode = RunMode.LOOP;

    /** Gap between the end of one cycle and the start of the next. */
    private Duration cycleInterval = Duration.ofMinutes(15);

    /** Per-attempt timeout for stages without an override. */
    private Duration stageTimeout = Duration.ofMinutes(10);

    /** Per-stage timeout overrides, keyed by stage name. */
    private Map<String, Duration> stageTimeouts = new LinkedHashMap<>();

    /** How long context shutdown waits for the run loop. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    private Retry       retry       = new Retry();
    private Circuit     circuit     = new Circuit();
    private Maintenance maintenance = new Maintenance();
    private Health      health      = new Health();
    private Retention   retention   = new Retention();

    /** Timeout for {@code stage}, or null to use {@link #getStageTimeout()}. */
    public Duration timeoutFor(String stage) {
        return stageTimeouts.get(stage);
    }

    public RunMode               getMode()            { return mode; }
    public Duration              getCycleInterval()   { return cycleInterval; }
    public Duration              getStageTimeout()    { return stageTimeout; }
    public Map<String, Duration> getStageTimeouts()   { return stageTimeouts; }
    public Duration              getShutdownTimeout() { return shutdownTimeout; }
    public Retry                 getRetry()           { return retry; }
    public Circuit               getCircuit()         { return circuit; }
    public Maintenance           getMaintenance()     { return maintenance; }
    public Health                getHealth()          { return health; }
    public Retention             getRetention()       { return retention; }

    public void setMode(RunMode mode)                               { this.mode = mode; }
    public void setCycleInterval(Duration cycleInterval)            { this.cycleInterval = cycleInterval; }
    public void setStageTimeout(Duration stageTimeout)              { this.stageTimeout = stageTimeout; }
    public void setStageTimeouts(Map<String, Duration> timeouts)    { this.stageTimeouts = timeouts; }
    public void setShutdownTimeout(Duration shutdownTimeout)        { this.shutdownTimeout = shutdownTimeout; }
    public void setRetry(Retry retry)                               { this.retry = retry; }
    public void setCircuit(Circuit circuit)                         { this.circuit = circuit; }
    public void setMaintenance(Maintenance maintenance)             { this.maintenance = maintenance; }
    public void setHealth(Health health)                            { this.health = health; }
    public void setRetention(Retention retention)                   { this.retention = retention; }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    public static class Retry {
        private int      maxRetries = 1;
        private Duration delay      = Duration.ofSeconds(30);

        public int      getMaxRetries()               { return maxRetries; }
        public Duration getDelay()                    { return delay; }
        public void     setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public void     setDelay(Duration delay)      { this.delay = delay; }
    }

    public static class Circuit {
        private int openThreshold    = 3;
        private int resetThreshold   = 5;
        private int probeEveryCycles = 1;

        /** Cycles a circuit may stay open before the stuck-circuit alarm fires. */
        private int stuckAlarmCycles = 12;

        public int  getOpenThreshold()              { return openThreshold; }
        public int  getResetThreshold()             { return resetThreshold; }
        public int  getProbeEveryCycles()           { return probeEveryCycles; }
        public int  getStuckAlarmCycles()           { return stuckAlarmCycles; }
        public void setOpenThreshold(int n)         { this.openThreshold = n; }
        public void setResetThreshold(int n)        { this.resetThreshold = n; }
        public void setProbeEveryCycles(int n)      { this.probeEveryCycles = n; }
        public void setStuckAlarmCycles(int n)      { this.stuckAlarmCycles = n; }
    }

    /** Daily low-activity window for the maintenance stage. */
    public static class Maintenance {
        private ZoneId zone      = ZoneId.of("UTC");
        private int    startHour = 2;
        private int    endHour   = 5;

        public ZoneId getZone()                  { return zone; }
        public int    getStartHour()             { return startHour; }
        public int    getEndHour()               { return endHour; }
        public void   setZone(ZoneId zone)       { this.zone = zone; }
        public void   setStartHour(int hour)     { this.startHour = hour; }
        public void   setEndHour(int hour)       { this.endHour = hour; }
    }

    public static class Health {
        public enum Persistence { JPA, MEMORY }

        private Persistence persistence      = Persistence.JPA;
        private boolean     fallbackToMemory = true;

        public Persistence getPersistence()                 { return persistence; }
        public boolean     isFallbackToMemory()             { return fallbackToMemory; }
        public void        setPersistence(Persistence p)    { this.persistence = p; }
        public void        setFallbackToMemory(boolean b)   { this.fallbackToMemory = b; }
    }

    public static class Retention {
        private Duration cycleHistory = Duration.ofDays(30);

        public Duration getCycleHistory()           { return cycleHistory; }
        public void     setCycleHistory(Duration d) { this.cycleHistory = d; }
    }
}
