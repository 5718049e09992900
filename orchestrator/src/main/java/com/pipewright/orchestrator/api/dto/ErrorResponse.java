package com.pipewright.orchestrator.api.dto;

public record ErrorResponse(String error, String message) {}
