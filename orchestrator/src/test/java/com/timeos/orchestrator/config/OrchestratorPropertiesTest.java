package com.timeos.orchestrator.config;

import com.timeos.orchestrator.cycle.RunMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binding of the orchestrator.* keys, without starting a context.
 */
class OrchestratorPropertiesTest {

    @Test
    void defaults() {
        OrchestratorProperties props = new OrchestratorProperties();

        assertThat(props.getMode()).isEqualTo(RunMode.LOOP);
        assertThat(props.getCycleInterval()).isEqualTo(Duration.ofMinutes(15));
        assertThat(props.getRetry().getMaxRetries()).isEqualTo(1);
        assertThat(props.getRetry().getDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getCircuit().getOpenThreshold()).isEqualTo(3);
        assertThat(props.getCircuit().getResetThreshold()).isEqualTo(5);
        assertThat(props.timeoutFor("truth")).isNull();
        assertThat(props.timeoutFor("collect")).isNull();
    }

    @Test
    void bindsRelaxedKeys() {
        Map<String, String> source = Map.of(
                "orchestrator.mode", "once",
                "orchestrator.cycle-interval", "5m",
                "orchestrator.stage-timeouts.collect", "90s",
                "orchestrator.circuit.probe-every-cycles", "4",
                "orchestrator.maintenance.zone", "Europe/Berlin",
                "orchestrator.health.persistence", "memory",
                "orchestrator.health.fallback-to-memory", "false");

        OrchestratorProperties props = new Binder(new MapConfigurationPropertySource(source))
                .bind("orchestrator", OrchestratorProperties.class)
                .get();

        assertThat(props.getMode()).isEqualTo(RunMode.ONCE);
        assertThat(props.getCycleInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.timeoutFor("collect")).isEqualTo(Duration.ofSeconds(90));
        assertThat(props.getCircuit().getProbeEveryCycles()).isEqualTo(4);
        assertThat(props.getMaintenance().getZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(props.getHealth().getPersistence()).isEqualTo(OrchestratorProperties.Health.Persistence.MEMORY);
        assertThat(props.getHealth().isFallbackToMemory()).isFalse();
    }
}
