package com.agentflow.runner.executor.impl;

import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.agent.AgentEventParser;
import com.agentflow.runner.executor.agent.AgentInvoker;
import com.agentflow.runner.executor.agent.PromptRenderer;
import com.agentflow.runner.model.Policy;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.policy.PolicyEnforcer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * {@code prompt} steps: a read-only agent call over the prompt file and the
 * step's input files. Edits and commands are always denied; reads are
 * limited to {@code inputs.paths} (the whole workspace when none are given).
 */
@Component
public class PromptStepExecutor extends AgentBackedExecutor {

    private final PromptRenderer prompts;
    private final int            maxFiles;
    private final int            timeoutSeconds;

    public PromptStepExecutor(AgentInvoker invoker, PromptRenderer prompts, Clock clock,
                              @Value("${agentflow.prompt.max-files:50}") int maxFiles,
                              @Value("${agentflow.prompt.timeout-seconds:300}") int timeoutSeconds) {
        super(invoker, clock);
        this.prompts        = prompts;
        this.maxFiles       = maxFiles;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override public StepType type() { return StepType.PROMPT; }

    @Override
    Policy policyFor(StepDefinition step) {
        List<String> paths = PromptRenderer.inputPaths(step);
        return Policy.readOnly(timeoutSeconds, maxFiles, paths.isEmpty() ? List.of("**") : paths);
    }

    @Override
    String prompt(StepDefinition step, RunContext ctx, PolicyEnforcer enforcer) {
        return prompts.render(step, ctx, enforcer);
    }

    @Override
    List<String> allowedTools(StepDefinition step) {
        return AgentEventParser.READ_ONLY_TOOLS;
    }
}
