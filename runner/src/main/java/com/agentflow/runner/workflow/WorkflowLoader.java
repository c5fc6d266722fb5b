package com.agentflow.runner.workflow;

import com.agentflow.runner.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads workflow files from disk and runs them through the validator.
 */
@Component
public class WorkflowLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);

    private final WorkflowValidator validator;

    public WorkflowLoader(WorkflowValidator validator) {
        this.validator = validator;
    }

    /**
     * Validate the file at {@code path} without executing anything.
     * A missing or unreadable file is reported as a violation, not thrown.
     */
    public ValidationReport validate(Path path) {
        Path file = path.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            return new ValidationReport(null, List.of(Violation.at("/", "file not found: " + file)), List.of());
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return new ValidationReport(null,
                    List.of(Violation.at("/", "could not read " + file + ": " + e.getMessage())), List.of());
        }
        ValidationReport report = validator.validate(text, file.getParent());
        log.debug("Validated {}: {} error(s), {} warning(s)",
                file, report.errors().size(), report.warnings().size());
        return report;
    }

    /**
     * Load a workflow for execution.
     *
     * @throws WorkflowValidationException if the file is missing or invalid
     */
    public WorkflowDefinition load(Path path) {
        return validate(path).orThrow(path.toString());
    }
}
