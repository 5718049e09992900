package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which column of the execution record a resume key is matched against. */
public enum ResumeKeyKind {
    TASK_ID,
    BRANCH,
    SESSION_ID;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    @JsonCreator
    public static ResumeKeyKind fromWire(String value) {
        for (ResumeKeyKind k : values()) {
            if (k.name().equalsIgnoreCase(value) || k.wireName().equalsIgnoreCase(value)) {
                return k;
            }
        }
        throw new IllegalArgumentException(
                "Unknown resume key kind '" + value + "'; expected task_id, branch or session_id");
    }
}
