package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Immutable definition of a process: an ordered list of step templates.
 *
 * The live, mutable queue lives in {@link ProcessRun}; this is the plan as
 * it was originally written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessSpec(
        @JsonProperty("name")         String               name,
        @JsonProperty("description")  String               description,
        @JsonProperty("steps")        List<ProcessStep>    steps,
        @JsonProperty("orchestrator") OrchestratorSettings orchestrator) {

    public ProcessSpec {
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (description == null) description = "";
    }

    public static ProcessSpec of(String name, List<ProcessStep> steps) {
        return new ProcessSpec(name, "", steps, null);
    }
}
