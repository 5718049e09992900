package com.pipewright.orchestrator.history;

/**
 * A payload was rejected before anything was written, such as a malformed
 * decision or an injected step naming an unknown task.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
