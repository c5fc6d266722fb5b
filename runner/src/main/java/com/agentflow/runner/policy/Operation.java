package com.agentflow.runner.policy;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of agent activity the enforcer decides on. */
public enum Operation {
    READ,
    EDIT,
    COMMAND;

    @JsonValue
    public String jsonName() { return name().toLowerCase(); }
}
