package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.model.DecisionType;
import com.pipewright.orchestrator.model.ProcessStep;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Shorthand for {@code set_process_decision(decision="inject", ...)}.
 */
@Component
public class InjectStepsTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "inject_steps", "1.0.0",
            "inject_steps(steps: list[dict], reasoning: str = None) -> dict",
            "Ask for steps [{task_name, prompt}] to run before the current step. Only valid in pre_step.",
            ToolScope.ORCHESTRATOR);

    private final DecisionRecorder recorder;

    public InjectStepsTool(DecisionRecorder recorder) {
        this.recorder = recorder;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        List<ProcessStep> steps = ToolArguments.steps(args, "steps");
        if (steps.isEmpty()) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS, "'steps' must name at least one step");
        }
        String reasoning = ToolArguments.optionalText(args, "reasoning");
        if (reasoning == null) {
            reasoning = "Injecting " + steps.stream().map(ProcessStep::task).toList();
        }
        return recorder.record(ctx, DecisionType.INJECT, reasoning, steps);
    }
}
