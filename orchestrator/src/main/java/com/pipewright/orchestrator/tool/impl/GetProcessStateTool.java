package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

@Component
public class GetProcessStateTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "get_process_state", "1.0.0",
            "get_process_state() -> dict",
            "Completed steps with results, pending steps, current index and decision history of this process.",
            ToolScope.ORCHESTRATOR);

    private final HistoryStore history;

    public GetProcessStateTool(HistoryStore history) {
        this.history = history;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        return history.readProcessState(ctx.processId());
    }
}
