package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.history.HistoryStore.StoredResult;
import com.pipewright.orchestrator.tool.ToolArguments;
import com.pipewright.orchestrator.tool.ToolCallContext;
import com.pipewright.orchestrator.tool.ToolException;

final class Results {

    private Results() {}

    /**
     * Result named by {@code task_id}, or the latest one of {@code task_name}
     * in the caller's own process. Exactly one of the two must be given.
     */
    static StoredResult lookup(HistoryStore history, JsonNode args, ToolCallContext ctx) {
        String taskId   = ToolArguments.optionalText(args, "task_id");
        String taskName = ToolArguments.optionalText(args, "task_name");
        if ((taskId == null) == (taskName == null)) {
            throw new ToolException(ToolException.Kind.INVALID_ARGUMENTS,
                    "give exactly one of 'task_id' or 'task_name'");
        }
        if (taskId != null) {
            return history.loadResult(taskId).orElseThrow(() ->
                    new ToolException(ToolException.Kind.NOT_FOUND, "No result for task '" + taskId + "'"));
        }
        requireCaller(ctx);
        return history.loadLatestResult(ctx.processId(), taskName).orElseThrow(() ->
                new ToolException(ToolException.Kind.NOT_FOUND, "No result for task '" + taskName + "' in this process"));
    }

    static void requireCaller(ToolCallContext ctx) {
        if (!ctx.resolved()) {
            throw new ToolException(ToolException.Kind.NOT_FOUND, "Unknown task id '" + ctx.taskId() + "'");
        }
    }
}
