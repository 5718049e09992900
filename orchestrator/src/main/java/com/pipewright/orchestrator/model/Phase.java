package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supervisory checkpoints around a process run.
 *
 * Each phase is backed by its own supervisor task definition, looked up in
 * the task registry by {@link #taskName()}.
 */
public enum Phase {
    PRE_STEP("pre_step", "orchestrator-pre"),          // plan / decide before a step runs
    POST_STEP("post_step", "orchestrator-post"),       // review only, never changes the flow
    FINALIZE("finalize", "orchestrator-finalize");     // once, after the last step

    private final String wireName;
    private final String taskName;

    Phase(String wireName, String taskName) {
        this.wireName = wireName;
        this.taskName = taskName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public String taskName() { return taskName; }

    @JsonCreator
    public static Phase fromWire(String value) {
        for (Phase p : values()) {
            if (p.wireName.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown phase: '" + value + "'");
    }
}
