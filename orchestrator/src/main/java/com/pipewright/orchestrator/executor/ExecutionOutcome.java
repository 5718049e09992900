package com.pipewright.orchestrator.executor;

import java.util.List;

/**
 * What the execution service reported when a run finished.
 *
 * @param sessionId engine session, kept for session-id resumption; may be null
 * @param error     error text when the run failed, otherwise null
 * @param refs      HEAD the run started from, then the commits it made; never null
 */
public record ExecutionOutcome(int exitCode, String sessionId, String error, List<String> refs) {

    public ExecutionOutcome {
        refs = refs == null ? List.of() : List.copyOf(refs);
    }

    public ExecutionOutcome(int exitCode, String sessionId, String error) {
        this(exitCode, sessionId, error, List.of());
    }

    public boolean succeeded() {
        return exitCode == 0 && (error == null || error.isBlank());
    }

    public static ExecutionOutcome failed(String error) {
        return new ExecutionOutcome(-1, null, error);
    }
}
