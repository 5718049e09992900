package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.Knowledge;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Every version of one knowledge key, oldest first, with a content preview. */
@Component
public class ViewKnowledgeHistoryTool implements Tool {

    public static final int PREVIEW_CHARS = 200;

    private static final ToolManifest MANIFEST = new ToolManifest(
            "view_knowledge_history", "1.0.0",
            "view_knowledge_history(key: str) -> dict",
            "All versions of a knowledge entry with reasons and previews. "
                    + "Use get_knowledge with a version for the full text.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public ViewKnowledgeHistoryTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String key = ToolArguments.requireText(args, "key");
        List<Knowledge> versions = history.readKnowledgeHistory(key);
        if (versions.isEmpty()) {
            throw new ToolException(ToolException.Kind.NOT_FOUND, "No knowledge under '" + key + "'");
        }
        return Map.of("key", key, "versions", versions.stream().map(k -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("version", k.getVersion());
            m.put("reason", k.getReason());
            m.put("created_at", k.getCreatedAt());
            m.put("preview", k.getContent().length() <= PREVIEW_CHARS
                    ? k.getContent()
                    : k.getContent().substring(0, PREVIEW_CHARS) + "...");
            return m;
        }).toList());
    }
}
