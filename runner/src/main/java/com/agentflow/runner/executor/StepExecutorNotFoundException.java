package com.agentflow.runner.executor;

import com.agentflow.runner.model.StepType;

public class StepExecutorNotFoundException extends StepExecutionException {
    public StepExecutorNotFoundException(StepType type) {
        super("No executor registered for step type: '" + type.yamlName() + "'");
    }
}
