package com.agentflow.runner.executor.impl;

import com.agentflow.runner.artifact.ArtifactType;
import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.artifact.TranscriptWriter;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutor;
import com.agentflow.runner.executor.StepMetrics;
import com.agentflow.runner.executor.agent.AgentInvoker;
import com.agentflow.runner.executor.agent.AgentRequest;
import com.agentflow.runner.executor.agent.AgentRun;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.Policy;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.policy.PolicyEnforcer;
import com.agentflow.runner.process.ProcessOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Shared flow of the step types that hand work to the coding agent.
 *
 * Writes, in order: {@code policy.json} before the agent starts, then
 * {@code transcript.md} while it streams, then {@code output.txt} and
 * {@code metrics.json} once it has exited.
 */
abstract class AgentBackedExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentBackedExecutor.class);

    private final AgentInvoker invoker;
    private final Clock        clock;

    AgentBackedExecutor(AgentInvoker invoker, Clock clock) {
        this.invoker = invoker;
        this.clock   = clock;
    }

    /** Effective policy for this execution. */
    abstract Policy policyFor(StepDefinition step);

    abstract String prompt(StepDefinition step, RunContext ctx, PolicyEnforcer enforcer);

    abstract List<String> allowedTools(StepDefinition step);

    @Override
    public StepResult execute(StepDefinition step, RunContext ctx) {
        Instant start = clock.instant();
        RunDirectory dir = ctx.runDirectory();
        Policy policy = policyFor(step);
        PolicyEnforcer enforcer = new PolicyEnforcer(policy, ctx.workspaceRoot());

        dir.writeJson(step.id(), ArtifactType.POLICY, policy);
        String prompt = prompt(step, ctx, enforcer);

        AgentRun run;
        try (TranscriptWriter transcript = dir.openTranscript(step.id())) {
            transcript.appendLine("# " + type().yamlName() + " step `" + step.id() + "`");
            transcript.appendLine("");
            run = invoker.invoke(new AgentRequest(step.id(), prompt, allowedTools(step),
                    Duration.ofSeconds(policy.timeoutSeconds()), ctx), enforcer, transcript);
        }

        ProcessOutcome outcome = run.outcome();
        String outputRef = dir.writeText(step.id(), ArtifactType.OUTPUT, run.output() + "\n");
        dir.writeJson(step.id(), ArtifactType.METRICS, StepMetrics.of(step.id(), type().yamlName(),
                Duration.between(start, clock.instant()), outcome.exitCode(), outcome.timedOut(), enforcer));
        Instant end = clock.instant();

        if (run.denied()) {
            return StepResult.failed(step.id(), FailureKind.POLICY_VIOLATION, outcome.exitCode(), start, end,
                    outputRef, "Policy violation: " + run.denial().operation().jsonName() + " denied, "
                            + run.denial().reason());
        }
        if (outcome.timedOut()) {
            return StepResult.failed(step.id(), FailureKind.TIMEOUT, outcome.exitCode(), start, end, outputRef,
                    "Agent exceeded timeout of " + policy.timeoutSeconds() + "s");
        }
        if (!outcome.succeeded()) {
            return StepResult.failed(step.id(), FailureKind.NON_ZERO_EXIT, outcome.exitCode(), start, end,
                    outputRef, "Agent exited with code " + outcome.exitCode());
        }
        log.info("Agent step {} completed: {} file(s) read, {} edit(s), {} command(s)",
                step.id(), enforcer.filesReadCount(), enforcer.editsMadeCount(), enforcer.commandsRunCount());
        return StepResult.completed(step.id(), outcome.exitCode(), start, end, outputRef);
    }
}
