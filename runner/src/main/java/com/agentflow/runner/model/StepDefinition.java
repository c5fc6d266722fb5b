package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One declared step of a workflow.
 *
 * Fields are a union over all step types; which ones are required depends
 * on {@link #type()} and is enforced by the validator, not here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepDefinition(
        @JsonProperty("id")              String              id,
        @JsonProperty("type")            StepType            type,
        @JsonProperty("prompt_file")     String              promptFile,
        @JsonProperty("command")         String              command,
        @JsonProperty("policy")          Policy              policy,
        @JsonProperty("available_tools") List<String>        availableTools,
        @JsonProperty("inputs")          Map<String, Object> inputs,
        @JsonProperty("on_error")        OnError             onError,
        @JsonProperty("timeout_seconds") Integer             timeoutSeconds,
        @JsonProperty("approve")         Boolean             approve,
        @JsonProperty("source_step")     String              sourceStep) {

    public OnError effectiveOnError() {
        return onError == null ? OnError.FAIL : onError;
    }

    public boolean continueOnError() {
        return effectiveOnError() == OnError.CONTINUE;
    }

    public List<String> availableToolsOrEmpty() {
        return availableTools == null ? List.of() : availableTools;
    }

    public Map<String, Object> inputsOrEmpty() {
        return inputs == null ? Map.of() : inputs;
    }
}
