package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Process-level overlay on the global orchestrator settings.
 *
 * Every field is optional; only non-empty values override the global defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestratorSettings(
        @JsonProperty("enabled")        Boolean enabled,
        @JsonProperty("engine")         String  engine,
        @JsonProperty("model")          String  model,
        @JsonProperty("max_injections") Integer maxInjections,
        @JsonProperty("image")          String  image) {

    public static OrchestratorSettings none() {
        return new OrchestratorSettings(null, null, null, null, null);
    }
}
