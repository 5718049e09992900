package com.pipewright.orchestrator.config;

import com.pipewright.orchestrator.model.OrchestratorSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorConfigResolverTest {

    PipewrightProperties properties;
    OrchestratorConfigResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new PipewrightProperties();
        properties.getOrchestrator().setEngine("claude");
        properties.getOrchestrator().setModel("sonnet");
        properties.getOrchestrator().setImage("pipewright/agent:1");
        resolver = new OrchestratorConfigResolver(properties);
    }

    @Test
    void noOverlay_usesGlobalDefaults() {
        OrchestratorConfig config = resolver.resolve(null);

        assertThat(config.enabled()).isTrue();
        assertThat(config.maxInjections()).isEqualTo(3);
        assertThat(config.engine()).isEqualTo("claude");
        assertThat(config.model()).isEqualTo("sonnet");
        assertThat(config.image()).isEqualTo("pipewright/agent:1");
    }

    @Test
    void overlay_overridesOnlyNonEmptyFields() {
        OrchestratorConfig config = resolver.resolve(
                new OrchestratorSettings(null, "  ", "opus", 1, ""));

        assertThat(config.enabled()).isTrue();
        assertThat(config.engine()).isEqualTo("claude");
        assertThat(config.model()).isEqualTo("opus");
        assertThat(config.maxInjections()).isEqualTo(1);
        assertThat(config.image()).isEqualTo("pipewright/agent:1");
    }

    @Test
    void overlay_canDisableTheSupervisor() {
        OrchestratorConfig config = resolver.resolve(new OrchestratorSettings(false, null, null, null, null));

        assertThat(config.enabled()).isFalse();
    }

    @Test
    void globalDisabled_canBeReenabledPerProcess() {
        properties.getOrchestrator().setEnabled(false);

        assertThat(resolver.resolve(OrchestratorSettings.none()).enabled()).isFalse();
        assertThat(resolver.resolve(new OrchestratorSettings(true, null, null, null, null)).enabled()).isTrue();
    }

    @Test
    void negativeLimit_isClampedToZero() {
        assertThat(resolver.resolve(new OrchestratorSettings(null, null, null, -2, null)).maxInjections()).isZero();
    }
}
