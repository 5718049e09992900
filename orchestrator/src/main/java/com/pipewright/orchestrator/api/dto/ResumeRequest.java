package com.pipewright.orchestrator.api.dto;

/**
 * Request body for POST /processes/resume.
 *
 * @param kind one of task_id, branch, session_id; defaults to task_id
 */
public record ResumeRequest(String key, String kind) {}
