package com.pipewright.orchestrator.task;

import com.pipewright.orchestrator.config.PipewrightProperties;
import com.pipewright.orchestrator.model.OrchestratorSettings;
import com.pipewright.orchestrator.model.ProcessSpec;
import com.pipewright.orchestrator.model.ProcessStep;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Named process definitions from {@code pipewright.processes}.
 */
@Component
public class ProcessCatalog {

    private final PipewrightProperties properties;

    public ProcessCatalog(PipewrightProperties properties) {
        this.properties = properties;
    }

    public Optional<ProcessSpec> find(String name) {
        PipewrightProperties.Process p = properties.getProcesses().get(name);
        if (p == null) return Optional.empty();

        List<ProcessStep> steps = p.getSteps().stream()
                .map(s -> new ProcessStep(s.getTask(), s.getEngine(), s.getModel(), s.getPrompt(),
                        s.isSkipOrchestrator(), null))
                .toList();
        PipewrightProperties.Overlay o = p.getOrchestrator();
        OrchestratorSettings overlay = o == null
                ? null
                : new OrchestratorSettings(o.getEnabled(), o.getEngine(), o.getModel(),
                        o.getMaxInjections(), o.getImage());
        return Optional.of(new ProcessSpec(name, p.getDescription(), steps, overlay));
    }

    public List<String> names() {
        return properties.getProcesses().keySet().stream().sorted().toList();
    }
}
