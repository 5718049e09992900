package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.model.DecisionType;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

@Component
public class SetProcessDecisionTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "set_process_decision", "1.0.0",
            "set_process_decision(decision: str, reasoning: str, injected_steps: list[dict] = None) -> dict",
            "Record proceed, inject or abort for the phase you are running. "
                    + "injected_steps is required for inject and not allowed otherwise.",
            ToolScope.ORCHESTRATOR);

    private final DecisionRecorder recorder;

    public SetProcessDecisionTool(DecisionRecorder recorder) {
        this.recorder = recorder;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        DecisionType type;
        try {
            type = DecisionType.fromWire(ToolArguments.requireText(args, "decision"));
        } catch (IllegalArgumentException e) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, e.getMessage());
        }
        String reasoning = ToolArguments.requireText(args, "reasoning");
        return recorder.record(ctx, type, reasoning, ToolArguments.steps(args, "injected_steps"));
    }
}
