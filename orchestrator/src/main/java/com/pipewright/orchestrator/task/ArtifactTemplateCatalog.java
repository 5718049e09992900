package com.pipewright.orchestrator.task;

import com.pipewright.orchestrator.config.PipewrightProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Artifact templates from {@code pipewright.artifact-templates}. Built once at
 * startup; a template with an unknown format fails the startup.
 */
@Component
public class ArtifactTemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(ArtifactTemplateCatalog.class);

    private final Map<String, ArtifactTemplate> templates = new TreeMap<>();

    public ArtifactTemplateCatalog(PipewrightProperties properties) {
        properties.getArtifactTemplates().forEach((name, t) -> {
            if (!ArtifactTemplate.FORMATS.contains(t.getFormat())) {
                throw new IllegalStateException("Artifact template '" + name + "' has unknown format '"
                        + t.getFormat() + "'; expected one of " + ArtifactTemplate.FORMATS);
            }
            templates.put(name, new ArtifactTemplate(name, t.getDescription(), t.getFormat(),
                    t.getContent(), t.getTags()));
        });
        log.info("Loaded {} artifact template(s): {}", templates.size(), templates.keySet());
    }

    public Optional<ArtifactTemplate> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(templates.get(name));
    }

    /** All templates, sorted by name. */
    public List<ArtifactTemplate> all() {
        return List.copyOf(templates.values());
    }
}
