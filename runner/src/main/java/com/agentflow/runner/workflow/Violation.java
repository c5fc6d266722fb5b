package com.agentflow.runner.workflow;

/**
 * One problem found while validating a workflow.
 *
 * @param location JSON pointer into the document, e.g. {@code /steps/1/policy/max_edits};
 *                 "/" for document-level problems
 * @param stepId   id of the offending step when known, otherwise null
 * @param message  human-readable description
 */
public record Violation(String location, String stepId, String message) {

    public static Violation at(String location, String message) {
        return new Violation(location, null, message);
    }

    public static Violation forStep(String location, String stepId, String message) {
        return new Violation(location, stepId, message);
    }

    /** Single-line rendering used by the CLI and exception messages. */
    public String describe() {
        return stepId == null
                ? location + ": " + message
                : location + ": Step '" + stepId + "': " + message;
    }
}
