package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.HistoryStore.StoredArtifact;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artifact metadata, without content, for one task or for the caller's
 * whole process.
 */
@Component
public class ListArtifactsTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "list_artifacts", "1.0.0",
            "list_artifacts(task_id: str = None) -> dict",
            "List artifacts of one task, or of every task in this process. Use load_artifact for the content.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public ListArtifactsTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String taskId = ToolArguments.optionalText(args, "task_id");
        List<StoredArtifact> found;
        if (taskId != null) {
            found = history.readArtifactsForTask(taskId);
        } else {
            Results.requireCaller(ctx);
            found = history.readArtifactsForProcess(ctx.processId());
        }
        return Map.of("artifacts", found.stream().map(ListArtifactsTool::metadata).toList());
    }

    private static Map<String, Object> metadata(StoredArtifact a) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("artifact_id", a.id());
        m.put("task_id", a.taskId());
        m.put("title", a.title());
        m.put("format", a.format());
        m.put("template_name", a.templateName());
        m.put("tags", a.tags());
        m.put("created_at", a.createdAt());
        return m;
    }
}
