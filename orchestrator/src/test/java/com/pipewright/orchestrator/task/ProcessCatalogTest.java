package com.pipewright.orchestrator.task;

import com.pipewright.orchestrator.config.PipewrightProperties;
import com.pipewright.orchestrator.model.ProcessSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessCatalogTest {

    PipewrightProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PipewrightProperties();

        PipewrightProperties.Task analyze = new PipewrightProperties.Task();
        analyze.setPrompt("Analyse the repository.");
        analyze.setTools(List.of("write_result"));
        properties.getTasks().put("analyze", analyze);

        PipewrightProperties.Step first = new PipewrightProperties.Step();
        first.setTask("analyze");
        PipewrightProperties.Step second = new PipewrightProperties.Step();
        second.setTask("implement");
        second.setModel("opus");
        second.setSkipOrchestrator(true);
        PipewrightProperties.Overlay overlay = new PipewrightProperties.Overlay();
        overlay.setMaxInjections(1);
        PipewrightProperties.Process process = new PipewrightProperties.Process();
        process.setDescription("Analyse then implement");
        process.setSteps(List.of(first, second));
        process.setOrchestrator(overlay);
        properties.getProcesses().put("analyze-and-implement", process);
    }

    @Test
    void find_mapsStepsAndOverlay() {
        ProcessSpec spec = new ProcessCatalog(properties).find("analyze-and-implement").orElseThrow();

        assertThat(spec.name()).isEqualTo("analyze-and-implement");
        assertThat(spec.steps()).extracting(s -> s.task()).containsExactly("analyze", "implement");
        assertThat(spec.steps().get(1).model()).isEqualTo("opus");
        assertThat(spec.steps().get(1).skipOrchestrator()).isTrue();
        assertThat(spec.steps()).noneMatch(s -> s.isInjected());
        assertThat(spec.orchestrator().maxInjections()).isEqualTo(1);
        assertThat(spec.orchestrator().enabled()).isNull();
    }

    @Test
    void find_unknownName_isEmpty() {
        assertThat(new ProcessCatalog(properties).find("nope")).isEmpty();
    }

    @Test
    void taskRegistry_resolvesConfiguredTasks() {
        TaskRegistry registry = new ConfiguredTaskRegistry(properties);

        assertThat(registry.require("analyze").tools()).containsExactly("write_result");
        assertThat(registry.contains("implement")).isFalse();
        assertThat(registry.getByName(null)).isEmpty();
        assertThatThrownBy(() -> registry.require("implement"))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessageContaining("implement");
    }
}
