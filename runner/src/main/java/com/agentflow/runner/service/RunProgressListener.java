package com.agentflow.runner.service;

import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.WorkflowDefinition;

import java.nio.file.Path;

/**
 * Progress callbacks from {@link WorkflowRunner}, invoked on the runner thread.
 */
public interface RunProgressListener {

    RunProgressListener NONE = new RunProgressListener() {};

    default void runStarted(String runId, WorkflowDefinition workflow, Path runDirectory) {}

    /** @param index zero-based position of the step in the workflow */
    default void stepStarted(int index, int total, StepDefinition step) {}

    default void stepFinished(StepDefinition step, StepResult result) {}

    default void runFinished(RunOutcome outcome) {}
}
