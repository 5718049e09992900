package com.pipewright.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The supervisor's verdict at a phase.
 */
public enum DecisionType {
    PROCEED,
    INJECT,
    ABORT;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    @JsonCreator
    public static DecisionType fromWire(String value) {
        if (value != null) {
            for (DecisionType d : values()) {
                if (d.name().equalsIgnoreCase(value.trim())) {
                    return d;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown decision '" + value + "'; expected one of proceed, inject, abort");
    }
}
