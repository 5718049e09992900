package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.HistoryStore.StoredResult;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ReadResultSummaryTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "read_result_summary", "1.0.0",
            "read_result_summary(task_id: str = None, task_name: str = None) -> dict",
            "Short summary and key files of a previous task's result. Prefer this over load_result to keep context small.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public ReadResultSummaryTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        StoredResult found = Results.lookup(history, args, ctx);
        if (found.summary() == null || found.summary().isBlank()) {
            throw new ToolException(ToolException.Kind.NOT_FOUND,
                    "No summary available for task '" + found.taskId()
                            + "'. Use load_result to read the full result.");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("task_id", found.taskId());
        out.put("summary", found.summary());
        out.put("key_files", found.keyFiles());
        return out;
    }
}
