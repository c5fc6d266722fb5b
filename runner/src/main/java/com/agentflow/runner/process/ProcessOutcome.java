package com.agentflow.runner.process;

import java.time.Duration;

/**
 * How a subprocess ended.
 *
 * @param exitCode          exit status, or null if the process never reported one
 * @param terminationReason set when the process was stopped on request
 */
public record ProcessOutcome(
        ProcessState state,
        Integer      exitCode,
        Duration     duration,
        String       terminationReason) {

    public boolean timedOut()   { return state == ProcessState.TIMED_OUT; }
    public boolean terminated() { return state == ProcessState.TERMINATED; }

    public boolean succeeded() {
        return state == ProcessState.EXITED && exitCode != null && exitCode == 0;
    }
}
