package com.pipewright.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipewright.orchestrator.executor.RepositoryInspector;
import com.pipewright.orchestrator.history.HistoryStore;
import com.pipewright.orchestrator.tool.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CommitLogTool implements Tool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "get_commit_log", "1.0.0",
            "get_commit_log(since_ref: str = None) -> dict",
            "Commits on this process's branch after the given ref. Defaults to the commit the "
                    + "process started from.",
            ToolScope.ORCHESTRATOR);

    private final HistoryStore        history;
    private final RepositoryInspector inspector;

    public CommitLogTool(HistoryStore history, RepositoryInspector inspector) {
        this.history   = history;
        this.inspector = inspector;
    }

    @Override public ToolManifest manifest() { return MANIFEST; }

    @Override
    public Object call(JsonNode args, ToolCallContext ctx) {
        String sinceRef = Worktrees.sinceRef(history, args, ctx);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("since_ref", sinceRef);
        out.put("commits", inspector.commitLog(Worktrees.workspaceRef(history, ctx), sinceRef));
        return out;
    }
}
