package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one executed worker step.
 */
public record StepResult(
        @JsonProperty("step_index")  int     stepIndex,
        @JsonProperty("task_name")   String  taskName,
        @JsonProperty("task_id")     String  taskId,
        @JsonProperty("success")     boolean success,
        @JsonProperty("exit_code")   int     exitCode,
        @JsonProperty("duration_ms") long    durationMs) {}
