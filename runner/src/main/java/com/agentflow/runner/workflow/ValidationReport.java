package com.agentflow.runner.workflow;

import com.agentflow.runner.model.WorkflowDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Result of validating a workflow document.
 *
 * {@link #workflow()} is present only when {@link #errors()} is empty:
 * a partially valid workflow is never handed out.
 */
public record ValidationReport(
        WorkflowDefinition workflowOrNull,
        List<Violation>    errors,
        List<Violation>    warnings) {

    public ValidationReport {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        if (!errors.isEmpty()) workflowOrNull = null;
    }

    public boolean valid() { return errors.isEmpty(); }

    public Optional<WorkflowDefinition> workflow() {
        return Optional.ofNullable(workflowOrNull);
    }

    /** Returns the workflow or throws {@link WorkflowValidationException}. */
    public WorkflowDefinition orThrow(String source) {
        if (!valid()) {
            throw new WorkflowValidationException(source, errors);
        }
        return workflowOrNull;
    }
}
