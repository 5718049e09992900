package com.pipewright.orchestrator.executor.dto;

import java.util.List;

/** Response from GET /workspace/{ref}/log. */
public record CommitLogResponse(String workspace_ref, List<Commit> commits) {

    public record Commit(String sha, String author, String date, String message) {}
}
