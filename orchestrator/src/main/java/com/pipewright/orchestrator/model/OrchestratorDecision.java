package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A supervisor verdict at one phase of a run.
 *
 * Valid shapes: {@code injectedSteps} is non-empty exactly when
 * {@code decision == INJECT}. The record itself accepts any shape so that a
 * malformed payload can be represented and then rejected by the history
 * store before it is written.
 *
 * @param taskId task id of the supervisor invocation that decided
 */
public record OrchestratorDecision(
        @JsonProperty("phase")          Phase             phase,
        @JsonProperty("step_index")     int               stepIndex,
        @JsonProperty("decision")       DecisionType      decision,
        @JsonProperty("reasoning")      String            reasoning,
        @JsonProperty("injected_steps") List<ProcessStep> injectedSteps,
        @JsonProperty("task_id")        String            taskId,
        @JsonProperty("created_at")     Instant           createdAt) {

    public OrchestratorDecision {
        injectedSteps = injectedSteps == null ? List.of() : List.copyOf(injectedSteps);
        if (reasoning == null) reasoning = "";
        if (createdAt == null) createdAt = Instant.now();
    }

    public static OrchestratorDecision proceed(Phase phase, int stepIndex, String reasoning, String taskId) {
        return new OrchestratorDecision(phase, stepIndex, DecisionType.PROCEED, reasoning, List.of(), taskId, null);
    }

    public static OrchestratorDecision abort(Phase phase, int stepIndex, String reasoning, String taskId) {
        return new OrchestratorDecision(phase, stepIndex, DecisionType.ABORT, reasoning, List.of(), taskId, null);
    }

    public static OrchestratorDecision inject(Phase phase, int stepIndex, String reasoning,
                                              List<ProcessStep> steps, String taskId) {
        return new OrchestratorDecision(phase, stepIndex, DecisionType.INJECT, reasoning, steps, taskId, null);
    }

    /** True when the decision/injected-steps combination is one of the allowed shapes. */
    @JsonIgnore
    public boolean hasValidShape() {
        if (phase == null || decision == null || stepIndex < 0) {
            return false;
        }
        return (decision == DecisionType.INJECT) == !injectedSteps.isEmpty();
    }
}
