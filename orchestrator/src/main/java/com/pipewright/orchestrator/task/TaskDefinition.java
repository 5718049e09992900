package com.pipewright.orchestrator.task;

import java.util.List;

/**
 * A named, reusable unit of agent work: the prompt, the tools it may see
 * and an optional default model.
 *
 * @param tools tool names the agent is told about; the scope gate still
 *              decides what it may actually call
 */
public record TaskDefinition(
        String       name,
        String       description,
        String       model,
        List<String> tools,
        String       prompt) {

    public TaskDefinition {
        tools = tools == null ? List.of() : List.copyOf(tools);
        if (description == null) description = "";
        if (prompt == null) prompt = "";
    }
}
