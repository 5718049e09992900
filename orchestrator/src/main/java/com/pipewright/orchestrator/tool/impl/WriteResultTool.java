package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class WriteResultTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "write_result", "1.1.0",
            "write_result(result: str, summary: str = None, key_files: list[str] = None, tags: list[str] = None) -> dict",
            "Store your findings for later steps, with an optional short summary. "
                    + "One result per task; a second call replaces the first.",
            ToolScope.SHARED);

    private final HistoryStore history;

    public WriteResultTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        Results.requireCaller(ctx);
        String result = ToolArguments.requireText(args, "result");
        history.writeResult(ctx.taskId(), result,
                ToolArguments.optionalText(args, "summary"),
                ToolArguments.optionalStringList(args, "key_files"),
                ToolArguments.optionalStringList(args, "tags"));
        return Map.of("task_id", ctx.taskId(), "stored", true);
    }
}
