package com.pipewright.orchestrator.tool;

/**
 * Controlled failure of a tool call, reported back to the calling agent.
 */
public class ToolException extends RuntimeException {

    public enum Kind { INVALID_ARGUMENTS, NOT_FOUND, SCOPE_VIOLATION, EXECUTION_ERROR }

    private final Kind kind;

    public ToolException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ToolException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
