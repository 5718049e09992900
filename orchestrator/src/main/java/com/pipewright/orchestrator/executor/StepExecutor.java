package com.pipewright.orchestrator.executor;

/**
 * The external task-execution service. Blocks until the run is over; time
 * limits, if any, are enforced on the service side.
 */
public interface StepExecutor {

    /**
     * @throws ExecutorException if the service cannot be reached or rejects the request
     */
    ExecutionOutcome run(ExecutionRequest request);
}
