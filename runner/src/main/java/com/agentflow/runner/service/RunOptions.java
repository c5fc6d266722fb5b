package com.agentflow.runner.service;

import java.nio.file.Path;

/**
 * Per-invocation switches for {@link WorkflowRunner}.
 *
 * @param artifactsRoot overrides where run directories live; null for the default
 * @param approveAll    treat every apply_diff step as approved
 */
public record RunOptions(Path artifactsRoot, boolean approveAll) {

    public static RunOptions defaults() {
        return new RunOptions(null, false);
    }
}
