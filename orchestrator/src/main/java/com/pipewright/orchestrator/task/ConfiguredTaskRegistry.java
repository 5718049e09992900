package com.pipewright.orchestrator.task;

import com.pipewright.orchestrator.config.PipewrightProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task registry backed by {@code pipewright.tasks} in application.yml.
 * Built once at startup.
 */
@Component
public class ConfiguredTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredTaskRegistry.class);

    private final Map<String, TaskDefinition> tasks = new ConcurrentHashMap<>();

    public ConfiguredTaskRegistry(PipewrightProperties properties) {
        properties.getTasks().forEach((name, t) -> {
            tasks.put(name, new TaskDefinition(name, t.getDescription(), t.getModel(),
                    t.getTools(), t.getPrompt()));
            log.info("Registered task '{}' ({} tool(s))", name, t.getTools().size());
        });
    }

    @Override
    public Optional<TaskDefinition> getByName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(tasks.get(name));
    }

    @Override
    public List<String> names() {
        return tasks.keySet().stream().sorted().toList();
    }
}
