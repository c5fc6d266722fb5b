package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * States of a run.
 *
 * Transitions:
 *   INITIALIZED → RUNNING               (first step starts, or resume)
 *   RUNNING     → COMPLETED             (all steps processed)
 *   RUNNING     → FAILED                (blocking step failure or runtime ceiling)
 *   FAILED      → RUNNING               (resume)
 */
public enum RunStatus {
    INITIALIZED,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String jsonName() { return name().toLowerCase(); }

    @JsonCreator
    static RunStatus parse(String value) {
        return valueOf(value.toUpperCase());
    }
}
