package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.task.ArtifactTemplateCatalog;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ListArtifactTemplatesTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "list_artifact_templates", "1.0.0",
            "list_artifact_templates() -> dict",
            "Names, descriptions and formats of the available artifact templates.",
            ToolScope.SHARED);

    private final ArtifactTemplateCatalog templates;

    public ListArtifactTemplatesTool(ArtifactTemplateCatalog templates) {
        this.templates = templates;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        return Map.of("templates", templates.all().stream().map(t -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", t.name());
            m.put("description", t.description());
            m.put("format", t.format());
            return m;
        }).toList());
    }
}
