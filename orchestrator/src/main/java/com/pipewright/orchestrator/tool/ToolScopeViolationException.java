package com.pipewright.orchestrator.tool;

/**
 * A non-orchestrator identity tried to call an orchestrator-only tool.
 */
public class ToolScopeViolationException extends ToolException {

    public ToolScopeViolationException(String taskId, String toolName) {
        super(Kind.SCOPE_VIOLATION, "Task '" + taskId + "' may not call orchestrator tool '" + toolName + "'");
    }
}
