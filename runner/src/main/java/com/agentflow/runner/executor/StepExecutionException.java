package com.agentflow.runner.executor;

/**
 * A step could not be executed because of the environment or the executor
 * itself, e.g. the agent binary is missing or a prompt file vanished.
 *
 * The runner records the step as a blocking {@code executor_error} failure.
 */
public class StepExecutionException extends RuntimeException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
