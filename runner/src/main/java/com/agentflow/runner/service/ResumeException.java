package com.agentflow.runner.service;

/**
 * A resume request cannot be honoured: unknown run, unknown step, or a
 * resume point after a step that never ran. Raised before anything is written.
 */
public class ResumeException extends RuntimeException {
    public ResumeException(String message) {
        super(message);
    }
}
