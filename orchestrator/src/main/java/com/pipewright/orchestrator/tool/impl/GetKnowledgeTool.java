package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.Knowledge;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class GetKnowledgeTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "get_knowledge", "1.0.0",
            "get_knowledge(key: str, version: int = None) -> dict",
            "Read a knowledge entry, the latest version unless one is given.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public GetKnowledgeTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String key = ToolArguments.requireText(args, "key");
        Integer version = ToolArguments.optionalInt(args, "version");
        Knowledge found = history.findKnowledge(key, version).orElseThrow(() ->
                new ToolException(ToolException.Kind.NOT_FOUND, version == null
                        ? "No knowledge under '" + key + "'"
                        : "No version " + version + " of knowledge '" + key + "'"));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", found.getKnowledgeKey());
        out.put("version", found.getVersion());
        out.put("content", found.getContent());
        out.put("reason", found.getReason());
        out.put("created_at", found.getCreatedAt());
        return out;
    }
}
