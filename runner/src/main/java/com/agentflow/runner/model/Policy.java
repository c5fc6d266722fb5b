package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Execution constraints attached to every agent step.
 *
 * All five fields are mandatory; the validator rejects a workflow that
 * omits any of them rather than falling back to defaults.
 *
 * @param timeoutSeconds   wall-clock limit for the agent subprocess, 1..3600
 * @param maxFiles         distinct files the agent may read, 0..1000
 * @param maxEdits         edit operations the agent may perform, 0..100
 * @param allowedPaths     globs relative to the workspace root; deny by default
 * @param commandAllowlist executable names the agent may run; empty denies all
 */
@JsonPropertyOrder({"timeout_seconds", "max_files", "max_edits", "allowed_paths", "cmd_allowlist"})
public record Policy(
        @JsonProperty("timeout_seconds") int          timeoutSeconds,
        @JsonProperty("max_files")       int          maxFiles,
        @JsonProperty("max_edits")       int          maxEdits,
        @JsonProperty("allowed_paths")   List<String> allowedPaths,
        @JsonProperty("cmd_allowlist")   List<String> commandAllowlist) {

    public static final int MAX_TIMEOUT_SECONDS = 3600;
    public static final int MAX_FILES           = 1000;
    public static final int MAX_EDITS           = 100;

    public Policy {
        allowedPaths     = allowedPaths == null ? List.of() : List.copyOf(allowedPaths);
        commandAllowlist = commandAllowlist == null ? List.of() : List.copyOf(commandAllowlist);
    }

    /** Read-only policy used by prompt steps: no edits, no commands. */
    public static Policy readOnly(int timeoutSeconds, int maxFiles, List<String> allowedPaths) {
        return new Policy(timeoutSeconds, maxFiles, 0, allowedPaths, List.of());
    }
}
