package com.pipewright.orchestrator.api.dto;

import com.pipewright.orchestrator.model.ProcessRecord;
import com.pipewright.orchestrator.model.ProcessRun;
import com.pipewright.orchestrator.model.WorktreeRef;

/**
 * Run summary for POST /processes, GET /processes/{id} and the resume and
 * continue endpoints.
 */
public record ProcessResponse(
        String processId,
        String processName,
        String state,
        int    currentIndex,
        String abortReason,
        String parentProcessId,
        String workspaceRef,
        String branch
) {
    public static ProcessResponse from(ProcessRun run) {
        WorktreeRef w = run.getWorktree();
        return new ProcessResponse(
                run.getProcessId(),
                run.getSpec().name(),
                run.getState().name(),
                run.getCurrentIndex(),
                run.getAbortReason(),
                run.getParentProcessId(),
                w == null ? null : w.workspaceRef(),
                w == null ? null : w.branch());
    }

    public static ProcessResponse from(ProcessRecord record) {
        return new ProcessResponse(
                record.getProcessId(),
                record.getProcessName(),
                record.getState().name(),
                record.getCurrentIndex(),
                record.getAbortReason(),
                record.getParentProcessId(),
                record.getWorkspaceRef(),
                record.getBranch());
    }
}
