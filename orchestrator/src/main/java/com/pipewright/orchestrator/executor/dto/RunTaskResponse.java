package com.pipewright.orchestrator.executor.dto;

import java.util.List;

/**
 * Response from POST /tasks/run.
 *
 * base_ref is the HEAD of the worktree before the agent ran; commits are the
 * commits it created, oldest first. Both may be absent.
 */
public record RunTaskResponse(
        int          exit_code,
        String       session_id,
        String       error,
        double       elapsed_sec,
        String       base_ref,
        List<String> commits
) {}
