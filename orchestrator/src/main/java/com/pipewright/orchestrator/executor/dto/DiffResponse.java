package com.pipewright.orchestrator.executor.dto;

/** Response from GET /workspace/{ref}/diff. */
public record DiffResponse(String workspace_ref, String since_ref, String diff) {}
