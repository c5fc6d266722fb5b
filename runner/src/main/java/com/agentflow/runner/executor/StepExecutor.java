package com.agentflow.runner.executor;

import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepType;

/**
 * Executes one kind of workflow step.
 *
 * Implementations declared as Spring {@code @Component}s are collected by
 * {@link StepExecutorRegistry}; supporting a {@code custom} step only
 * requires registering a bean whose {@link #type()} is
 * {@link StepType#CUSTOM}.
 *
 * <p>Ordinary failures (non-zero exit, timeout, policy denial, missing
 * approval) are returned as a FAILED {@link StepResult}. Only errors in the
 * environment or the executor itself are thrown.
 */
public interface StepExecutor {

    StepType type();

    /**
     * @throws StepExecutionException if the step could not be carried out at all
     * @throws com.agentflow.runner.artifact.ArtifactWriteException if an artifact could not be persisted
     */
    StepResult execute(StepDefinition step, RunContext ctx);
}
