package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.model.WorktreeRef;
import com.pipewright.orchestrator.tool.ToolArguments;
import com.pipewright.orchestrator.tool.ToolCallContext;
import com.pipewright.orchestrator.tool.ToolException;

final class Worktrees {

    private Worktrees() {}

    /** Workspace ref of the caller's run, for the repository tools. */
    static String workspaceRef(HistoryStore history, ToolCallContext ctx) {
        WorktreeRef worktree = history.requireProcess(ctx.processId()).worktree();
        if (worktree == null || worktree.workspaceRef() == null) {
            throw new ToolException(ToolException.Kind.EXECUTION_ERROR,
                    "Process " + ctx.processId() + " has no worktree");
        }
        return worktree.workspaceRef();
    }

    /**
     * {@code since_ref} if given, else the earliest commit recorded for the
     * caller's process. Null when neither exists.
     */
    static String sinceRef(HistoryStore history, JsonNode args, ToolCallContext ctx) {
        String given = ToolArguments.optionalText(args, "since_ref");
        if (given != null && !given.isBlank()) return given;
        return history.earliestRefForProcess(ctx.processId()).orElse(null);
    }
}
