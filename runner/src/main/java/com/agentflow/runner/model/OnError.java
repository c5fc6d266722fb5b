package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the runner does when a step fails.
 *
 * FAIL:     halt the run (default).
 * CONTINUE: record the step as failed but keep going.
 */
public enum OnError {
    FAIL,
    CONTINUE;

    @JsonValue
    public String yamlName() { return name().toLowerCase(); }

    @JsonCreator
    static OnError parse(String value) {
        return valueOf(value.toUpperCase());
    }
}
