package com.pipewright.orchestrator.api.dto;

import java.util.List;

/** Names of the configured processes and tasks, for GET /processes/definitions. */
public record DefinitionsResponse(List<String> processes, List<String> tasks) {}
