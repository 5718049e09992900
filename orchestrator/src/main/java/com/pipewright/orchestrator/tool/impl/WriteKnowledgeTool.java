package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.Knowledge;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WriteKnowledgeTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "write_knowledge", "1.0.0",
            "write_knowledge(key: str, content: str, reason: str) -> dict",
            "Store a new version of a knowledge entry that later tasks and processes can read. "
                    + "Earlier versions are kept.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public WriteKnowledgeTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        Knowledge saved = history.writeKnowledge(
                ToolArguments.requireText(args, "key"),
                ToolArguments.requireText(args, "content"),
                ToolArguments.requireText(args, "reason"));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("key", saved.getKnowledgeKey());
        out.put("version", saved.getVersion());
        return out;
    }
}
