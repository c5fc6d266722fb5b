package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Outcome of one step execution, as stored in {@code run-state.json}.
 *
 * Ordinary failures (non-zero exit, timeout, policy denial) are expressed
 * as a FAILED result, never as an exception.
 *
 * @param outputRef   path of the step's primary artifact, relative to the run directory
 * @param blocking    false when the step failed but declared {@code on_error: continue}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResult(
        String      stepId,
        StepStatus  status,
        Integer     exitCode,
        Instant     startTime,
        Instant     endTime,
        String      outputRef,
        String      errorMessage,
        FailureKind failureKind,
        boolean     blocking) {

    public static StepResult completed(String stepId, Integer exitCode,
                                       Instant start, Instant end, String outputRef) {
        return new StepResult(stepId, StepStatus.COMPLETED, exitCode, start, end,
                outputRef, null, null, false);
    }

    public static StepResult failed(String stepId, FailureKind kind, Integer exitCode,
                                    Instant start, Instant end, String outputRef,
                                    String errorMessage) {
        return new StepResult(stepId, StepStatus.FAILED, exitCode, start, end,
                outputRef, errorMessage, kind, true);
    }

    /** Same result, downgraded to non-blocking because the step continues on error. */
    public StepResult nonBlocking() {
        return new StepResult(stepId, status, exitCode, startTime, endTime,
                outputRef, errorMessage, failureKind, false);
    }

    @JsonIgnore
    public boolean isFailed() { return status == StepStatus.FAILED; }

    @JsonIgnore
    public boolean haltsRun() { return isFailed() && blocking; }
}
