package com.agentflow.runner.service;

import com.agentflow.runner.model.RunStatus;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Summary of a run (or resume) invocation handed back to the CLI.
 *
 * @param artifactsRoot directory holding the run directory when it is not the configured default; null otherwise
 * @param failedStepId  step whose blocking failure halted the run; null otherwise
 * @param resumeStepId  where {@code resume} should pick up; null when the run completed
 * @param message       reason the run failed
 */
public record RunOutcome(
        String    runId,
        RunStatus status,
        Path      runDirectory,
        Path      artifactsRoot,
        String    failedStepId,
        String    resumeStepId,
        String    message) {

    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_./:@%+=,-]+");

    public boolean succeeded() {
        return status == RunStatus.COMPLETED;
    }

    /** The exact command that resumes this run, or null if there is nothing to resume. */
    public String resumeCommand() {
        if (resumeStepId == null) return null;
        String command = "agentflow resume " + runId + " --from " + resumeStepId;
        return artifactsRoot == null ? command : command + " --artifacts-dir " + shellQuote(artifactsRoot.toString());
    }

    private static String shellQuote(String value) {
        return SHELL_SAFE.matcher(value).matches() ? value : "'" + value.replace("'", "'\\''") + "'";
    }
}
