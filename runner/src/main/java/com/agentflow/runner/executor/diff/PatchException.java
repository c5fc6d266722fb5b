package com.agentflow.runner.executor.diff;

/**
 * A diff could not be parsed, or one of its hunks does not fit the file it targets.
 */
public class PatchException extends RuntimeException {

    public PatchException(String message) {
        super(message);
    }
}
