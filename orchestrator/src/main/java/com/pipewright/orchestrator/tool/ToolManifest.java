package com.pipewright.orchestrator.tool;

/**
 * Identity and documentation of a tool, as returned by the listing.
 *
 * @param signature call signature shown to agents, e.g. "write_result(result: str, ...) -> dict"
 * @param scope     {@link ToolScope#ORCHESTRATOR} tools never appear in a worker's listing
 */
public record ToolManifest(
        String    name,
        String    version,
        String    signature,
        String    description,
        ToolScope scope) {}
