package com.agentflow.runner.executor.impl;

import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.agent.AgentInvoker;
import com.agentflow.runner.executor.agent.PromptRenderer;
import com.agentflow.runner.model.Policy;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.policy.PolicyEnforcer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * {@code agent} steps: the agent works on the workspace under the step's
 * declared policy, which the validator guarantees is complete.
 */
@Component
public class AgentStepExecutor extends AgentBackedExecutor {

    private final PromptRenderer prompts;

    public AgentStepExecutor(AgentInvoker invoker, PromptRenderer prompts, Clock clock) {
        super(invoker, clock);
        this.prompts = prompts;
    }

    @Override public StepType type() { return StepType.AGENT; }

    @Override
    Policy policyFor(StepDefinition step) {
        return step.policy();
    }

    @Override
    String prompt(StepDefinition step, RunContext ctx, PolicyEnforcer enforcer) {
        return prompts.promptText(step, ctx);
    }

    @Override
    List<String> allowedTools(StepDefinition step) {
        return step.availableToolsOrEmpty();
    }
}
