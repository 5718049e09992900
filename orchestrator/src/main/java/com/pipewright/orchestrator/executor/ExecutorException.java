package com.pipewright.orchestrator.executor;

/**
 * Thrown when the task-execution service returns an error or is unreachable.
 * A worker step that ends this way is a failed step.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
