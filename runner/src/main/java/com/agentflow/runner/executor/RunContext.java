package com.agentflow.runner.executor;

import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.model.WorkflowDefinition;

import java.nio.file.Path;

/**
 * Everything an executor needs to know about the run it belongs to.
 *
 * @param workspaceRoot directory the steps operate on; policy paths are relative to it
 * @param workflowDir   directory of the workflow file; prompt files resolve against it
 * @param approveAll    treat every apply_diff step as approved
 */
public record RunContext(
        String             runId,
        WorkflowDefinition workflow,
        RunDirectory       runDirectory,
        Path               workspaceRoot,
        Path               workflowDir,
        boolean            approveAll) {
}
