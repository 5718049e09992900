package com.pipewright.orchestrator.api.dto;

/** Request body for POST /processes/continue. */
public record ContinueRequest(String parentTaskId, String prompt) {}
