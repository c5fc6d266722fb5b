package com.agentflow.runner.cli;

import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.service.RunOutcome;
import com.agentflow.runner.service.RunProgressListener;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Prints run progress, including the failure summary and resume command, to stdout.
 */
class ConsoleProgressListener implements RunProgressListener {

    private final PrintWriter out;

    ConsoleProgressListener(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void runStarted(String runId, WorkflowDefinition workflow, Path runDirectory) {
        out.println("Run " + runId + " [" + workflow.name() + "]");
        out.println("  artifacts: " + runDirectory);
        out.flush();
    }

    @Override
    public void stepStarted(int index, int total, StepDefinition step) {
        out.println("[" + (index + 1) + "/" + total + "] " + step.id() + " (" + step.type().yamlName() + ") ...");
        out.flush();
    }

    @Override
    public void stepFinished(StepDefinition step, StepResult result) {
        long millis = result.startTime() != null && result.endTime() != null
                ? Duration.between(result.startTime(), result.endTime()).toMillis() : 0;
        if (!result.isFailed()) {
            out.println("      " + result.status().jsonName() + " in " + millis + "ms");
        } else {
            out.println("      failed (" + result.failureKind().jsonName() + ")"
                    + (result.blocking() ? "" : ", continuing") + ": " + result.errorMessage());
        }
        out.flush();
    }

    @Override
    public void runFinished(RunOutcome outcome) {
        if (outcome.succeeded()) {
            out.println("Run " + outcome.runId() + " completed");
        } else {
            out.println("Run " + outcome.runId() + " failed"
                    + (outcome.failedStepId() != null ? " at step '" + outcome.failedStepId() + "'" : "")
                    + (outcome.message() != null ? ": " + outcome.message() : ""));
            if (outcome.resumeCommand() != null) {
                out.println("Resume with: " + outcome.resumeCommand());
            }
        }
        out.flush();
    }
}
