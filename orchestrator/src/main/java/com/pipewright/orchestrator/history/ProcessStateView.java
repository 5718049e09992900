package com.pipewright.orchestrator.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pipewright.orchestrator.model.OrchestratorDecision;
import com.pipewright.orchestrator.model.ProcessStep;
import com.pipewright.orchestrator.model.RunState;
import com.pipewright.orchestrator.model.StepResult;

import java.util.List;

/**
 * Read model behind the {@code get_process_state} tool.
 *
 * Built from the live step list, so steps injected mid-run show up here in
 * execution order.
 */
public record ProcessStateView(
        @JsonProperty("process_id")    String                     processId,
        @JsonProperty("process_name")  String                     processName,
        @JsonProperty("state")         RunState                   state,
        @JsonProperty("current_index") int                        currentIndex,
        @JsonProperty("total_steps")   int                        totalSteps,
        @JsonProperty("completed")     List<CompletedStep>        completed,
        @JsonProperty("pending")       List<PendingStep>          pending,
        @JsonProperty("decisions")     List<OrchestratorDecision> decisions) {

    public record CompletedStep(
            @JsonProperty("index")  int         index,
            @JsonProperty("step")   ProcessStep step,
            @JsonProperty("result") StepResult  result) {}

    public record PendingStep(
            @JsonProperty("index") int         index,
            @JsonProperty("step")  ProcessStep step) {}
}
