package com.agentflow.runner.executor;

import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.policy.PolicyEnforcer;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.util.List;

/**
 * Contents of a step's {@code metrics.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"step_id", "type", "duration_ms", "exit_code", "timed_out",
        "files_read", "edits_made", "commands_run", "denials"})
public record StepMetrics(
        @JsonProperty("step_id")      String               stepId,
        @JsonProperty("type")         String               type,
        @JsonProperty("duration_ms")  long                 durationMs,
        @JsonProperty("exit_code")    Integer              exitCode,
        @JsonProperty("timed_out")    boolean              timedOut,
        @JsonProperty("files_read")   int                  filesRead,
        @JsonProperty("edits_made")   int                  editsMade,
        @JsonProperty("commands_run") int                  commandsRun,
        @JsonProperty("denials")      List<PolicyDecision> denials) {

    public static StepMetrics of(String stepId, String type, Duration duration, Integer exitCode,
                                 boolean timedOut, PolicyEnforcer enforcer) {
        return new StepMetrics(stepId, type, duration.toMillis(), exitCode, timedOut,
                enforcer.filesReadCount(), enforcer.editsMadeCount(), enforcer.commandsRunCount(),
                enforcer.denials());
    }
}
