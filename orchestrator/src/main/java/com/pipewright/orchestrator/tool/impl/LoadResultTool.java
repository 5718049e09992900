package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.HistoryStore.StoredResult;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Load a stored result either by task id, or by task name within the
 * caller's own process (latest wins).
 */
@Component
public class LoadResultTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "load_result", "1.0.0",
            "load_result(task_id: str = None, task_name: str = None) -> dict",
            "Load the result a previous task stored, by its task id or by task name in this process.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public LoadResultTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        StoredResult found = Results.lookup(history, args, ctx);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("task_id", found.taskId());
        out.put("result", found.result());
        out.put("key_files", found.keyFiles());
        out.put("tags", found.tags());
        return out;
    }
}
