package com.agentflow.runner.cli;

import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.workflow.ValidationReport;
import com.agentflow.runner.workflow.Violation;
import com.agentflow.runner.workflow.WorkflowLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Component
@Command(name = "validate", description = "Validate a workflow file without running it.")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Workflow YAML file")
    Path file;

    private final WorkflowLoader loader;

    public ValidateCommand(WorkflowLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ValidationReport report = loader.validate(file);

        if (!report.valid()) {
            err.println("Workflow " + file + " is invalid:");
            report.errors().forEach(v -> err.println("  - " + v.describe()));
            printWarnings(err, report);
            return ExitCodes.FAIL;
        }

        WorkflowDefinition workflow = report.workflow().orElseThrow();
        out.println("Workflow " + file + " is valid");
        out.println("  name:       " + workflow.name());
        out.println("  steps:      " + workflow.steps().size() + " ("
                + workflow.steps().stream().map(StepDefinition::id).collect(Collectors.joining(", ")) + ")");
        out.println("  model:      " + (workflow.modelIdentifier() == null ? "(default)" : workflow.modelIdentifier()));
        out.println("  guardrails: " + (workflow.guardrailIds().isEmpty() ? "none" : String.join(", ", workflow.guardrailIds())));
        printWarnings(out, report);
        return ExitCodes.OK;
    }

    private static void printWarnings(PrintWriter w, ValidationReport report) {
        if (report.warnings().isEmpty()) return;
        w.println("Warnings:");
        for (Violation v : report.warnings()) {
            w.println("  - " + v.describe());
        }
    }
}
