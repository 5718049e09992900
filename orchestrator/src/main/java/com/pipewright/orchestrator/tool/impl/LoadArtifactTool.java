package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

@Component
public class LoadArtifactTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "load_artifact", "1.0.0",
            "load_artifact(artifact_id: str) -> dict",
            "Load a full artifact, content included, by its id.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public LoadArtifactTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String artifactId = ToolArguments.requireText(args, "artifact_id");
        return history.findArtifact(artifactId).orElseThrow(() ->
                new ToolException(ToolException.Kind.NOT_FOUND, "No artifact '" + artifactId + "'"));
    }
}
