package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of a single executed step. */
public enum StepStatus {
    COMPLETED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String jsonName() { return name().toLowerCase(); }

    @JsonCreator
    static StepStatus parse(String value) {
        return valueOf(value.toUpperCase());
    }
}
