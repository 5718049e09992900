package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.executor.RepositoryInspector;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class GitDiffTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "get_git_diff", "1.0.0",
            "get_git_diff(since_ref: str = None) -> dict",
            "Unified diff of this process's worktree since the given ref. Defaults to the commit the "
                    + "process started from, or HEAD when none is recorded.",
            ToolScope.ORCHESTRATOR);

    private final HistoryStore        history;
    private final RepositoryInspector inspector;

    public GitDiffTool(HistoryStore history, RepositoryInspector inspector) {
        this.history   = history;
        this.inspector = inspector;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String sinceRef = Worktrees.sinceRef(history, args, ctx);
        String workspaceRef = Worktrees.workspaceRef(history, ctx);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("since_ref", sinceRef);
        out.put("diff", inspector.diff(workspaceRef, sinceRef));
        return out;
    }
}
