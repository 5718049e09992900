package com.pipewright.orchestrator.executor;

import com.pipewright.orchestrator.model.WorktreeRef;
import com.pipewright.orchestrator.task.TaskDefinition;

/**
 * One blocking run on the execution service: a worker step or a supervisor
 * phase.
 *
 * @param taskId       identity the agent presents on every tool call
 * @param prompt       task prompt plus the orientation context built for this run
 * @param image        container image override, null for the service default
 * @param orchestrator true for supervisor invocations
 */
public record ExecutionRequest(
        String         taskId,
        String         processId,
        TaskDefinition task,
        String         engine,
        String         model,
        String         image,
        WorktreeRef    worktree,
        String         prompt,
        boolean        orchestrator) {}
