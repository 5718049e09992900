package com.pipewright.orchestrator.model;

/**
 * Opaque handle on the isolated checkout a run operates in.
 *
 * Created and destroyed by the worktree provider, never by the orchestrator.
 * The orchestrator only carries it along and hands it to the executor.
 *
 * @param workspaceRef executor-side identifier of the workspace
 * @param branch       branch checked out in the worktree
 * @param path         filesystem path on the executor host (informational)
 */
public record WorktreeRef(String workspaceRef, String branch, String path) {

    public static WorktreeRef of(String workspaceRef, String branch) {
        return new WorktreeRef(workspaceRef, branch, null);
    }
}
