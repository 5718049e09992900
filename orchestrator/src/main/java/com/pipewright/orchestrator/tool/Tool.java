package com.pipewright.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One operation of the tool-call protocol agents use to talk back to the
 * orchestrator. Every implementation is a Spring {@code @Component} and is
 * picked up by {@link ToolRegistry} automatically.
 *
 * Scope checks happen in {@link ToolScopeGate} before {@link #call} is
 * reached; implementations only validate their own arguments.
 */
public interface Tool {

    ToolManifest manifest();

    /**
     * @param args JSON object of arguments, never null
     * @return a JSON-serialisable result
     * @throws ToolException on bad arguments or a failed lookup
     */
    Object call(JsonNode args, ToolCallContext ctx);
}
