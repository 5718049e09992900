package com.pipewright.orchestrator.api.dto;

import com.pipewright.orchestrator.model.TaskLog;

import java.time.Instant;
import java.util.List;

/**
 * One execution record as listed by GET /processes/{id}/tasks. Prompts are
 * left out; the hash identifies them.
 *
 * @param status RUNNING until the executor returned, then SUCCESS or FAILED
 * @param refs   commits reported for the step, the starting HEAD first
 */
public record TaskLogResponse(
        String  taskId,
        String  taskName,
        boolean orchestrator,
        String  phase,
        Integer stepIndex,
        String  status,
        Integer exitCode,
        Long    durationMs,
        String  sessionId,
        String  parentId,
        String  promptHash,
        Instant createdAt,
        List<String> refs
) {
    public static TaskLogResponse from(TaskLog t, List<String> refs) {
        String status = !t.isFinished() ? "RUNNING"
                      : Boolean.TRUE.equals(t.getSuccess()) ? "SUCCESS"
                      : "FAILED";
        return new TaskLogResponse(
                t.getTaskId(),
                t.getTaskName(),
                t.isOrchestrator(),
                t.getPhase(),
                t.getStepIndex(),
                status,
                t.getExitCode(),
                t.getDurationMs(),
                t.getSessionId(),
                t.getParentId(),
                t.getPromptHash(),
                t.getCreatedAt(),
                refs);
    }
}
