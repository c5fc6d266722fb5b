package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * A validated, typed workflow.
 *
 * Instances are only produced by the validator, so every invariant
 * (unique ids, at least one step, complete agent policies) already holds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowDefinition(
        @JsonProperty("version")    int                  schemaVersion,
        @JsonProperty("workflow")   String               name,
        @JsonProperty("model")      String               modelIdentifier,
        @JsonProperty("guardrails") List<String>         guardrailIds,
        @JsonProperty("env")        RuntimeLimits        runtimeLimits,
        @JsonProperty("steps")      List<StepDefinition> steps) {

    public static final int SCHEMA_VERSION = 1;

    public WorkflowDefinition {
        guardrailIds  = guardrailIds == null ? List.of() : List.copyOf(guardrailIds);
        runtimeLimits = runtimeLimits == null ? RuntimeLimits.none() : runtimeLimits;
        steps         = steps == null ? List.of() : List.copyOf(steps);
    }

    /** Index of the step with the given id, or -1. */
    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) return i;
        }
        return -1;
    }

    public Optional<StepDefinition> step(String stepId) {
        int idx = indexOf(stepId);
        return idx < 0 ? Optional.empty() : Optional.of(steps.get(idx));
    }

    @JsonIgnore
    public List<String> stepIds() {
        return steps.stream().map(StepDefinition::id).toList();
    }
}
