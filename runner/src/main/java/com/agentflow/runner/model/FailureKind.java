package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Why a step failed. Recorded on the {@link StepResult}. */
public enum FailureKind {
    POLICY_VIOLATION,
    TIMEOUT,
    NON_ZERO_EXIT,
    APPROVAL_REQUIRED,
    EXECUTOR_ERROR;

    @JsonValue
    public String jsonName() { return name().toLowerCase(); }

    @JsonCreator
    static FailureKind parse(String value) {
        return valueOf(value.toUpperCase());
    }
}
