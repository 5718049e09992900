package com.pipewright.orchestrator.tool;

import com.pipewright.orchestrator.model.Phase;

/**
 * Caller identity as resolved from its execution record for this one call.
 *
 * @param processId    null when the task id did not resolve
 * @param phase        set for supervisor invocations, null for workers
 * @param stepIndex    the step the invocation belongs to
 */
public record ToolCallContext(
        String  taskId,
        String  processId,
        Phase   phase,
        Integer stepIndex,
        boolean orchestrator) {

    public static ToolCallContext unresolved(String taskId) {
        return new ToolCallContext(taskId, null, null, null, false);
    }

    public boolean resolved() {
        return processId != null;
    }
}
