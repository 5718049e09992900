package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.task.ArtifactTemplateCatalog;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

@Component
public class LoadArtifactTemplateTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "load_artifact_template", "1.0.0",
            "load_artifact_template(template_name: str) -> dict",
            "Full content of an artifact template, as a starting point for write_artifact.",
            ToolScope.SHARED);

    private final ArtifactTemplateCatalog templates;

    public LoadArtifactTemplateTool(ArtifactTemplateCatalog templates) {
        this.templates = templates;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String name = ToolArguments.requireText(args, "template_name");
        return templates.find(name).orElseThrow(() ->
                new ToolException(ToolException.Kind.NOT_FOUND, "No artifact template '" + name + "'"));
    }
}
