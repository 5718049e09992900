package com.pipewright.orchestrator.executor;

import com.pipewright.orchestrator.executor.dto.CommitLogResponse;

/**
 * Read-only view on the version control state of a run's worktree.
 */
public interface RepositoryInspector {

    /** Unified diff of the worktree against {@code sinceRef} (HEAD when null). */
    String diff(String workspaceRef, String sinceRef);

    /** Commits on the worktree branch after {@code sinceRef} (all when null). */
    CommitLogResponse commitLog(String workspaceRef, String sinceRef);
}
