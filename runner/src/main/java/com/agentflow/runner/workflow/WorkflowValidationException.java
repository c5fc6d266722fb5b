package com.agentflow.runner.workflow;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow fails validation. No run is started and no
 * run directory is created.
 */
public class WorkflowValidationException extends RuntimeException {

    private final List<Violation> violations;

    public WorkflowValidationException(String source, List<Violation> violations) {
        super("Workflow validation failed for " + source + ":\n" + violations.stream()
                .map(v -> "  " + v.describe())
                .collect(Collectors.joining("\n")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() { return violations; }
}
