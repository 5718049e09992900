package com.pipewright.orchestrator.model;

/**
 * States of a process run as driven by the state machine.
 *
 * Transitions:
 *   RUNNING → (per step: PRE_DECISION → EXECUTING → POST_REVIEW) → FINALIZING → COMPLETED
 *
 * Any non-terminal state can move to ABORTED, either on a worker failure or
 * on an abort decision applied at a phase boundary.
 */
public enum RunState {
    RUNNING,
    PRE_DECISION,
    EXECUTING,
    POST_REVIEW,
    FINALIZING,
    COMPLETED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }
}
