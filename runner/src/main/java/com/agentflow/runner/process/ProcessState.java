package com.agentflow.runner.process;

/**
 * Lifecycle of one step subprocess.
 *
 * <pre>
 *   SPAWNED → STREAMING → EXITED
 *                       ↘ TIMED_OUT   (deadline passed before exit was observed)
 *                       ↘ TERMINATED  (stopped on request, e.g. a policy denial)
 * </pre>
 */
public enum ProcessState {
    SPAWNED,
    STREAMING,
    EXITED,
    TIMED_OUT,
    TERMINATED;

    public boolean isFinal() {
        return this == EXITED || this == TIMED_OUT || this == TERMINATED;
    }
}
