package com.agentflow.runner.executor.impl;

import com.agentflow.runner.artifact.ArtifactType;
import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutionException;
import com.agentflow.runner.executor.StepExecutor;
import com.agentflow.runner.executor.StepMetrics;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.Policy;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.policy.PolicyEnforcer;
import com.agentflow.runner.process.ProcessOutcome;
import com.agentflow.runner.process.ProcessSpec;
import com.agentflow.runner.process.SubprocessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@code cmd} steps: run a shell command line in the workspace.
 *
 * Every executable in the line must be on {@code agentflow.command.allowlist}.
 * output.txt records the command, the exit code and the merged output.
 */
@Component
public class CommandStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandStepExecutor.class);

    private final SubprocessRunner processes;
    private final Clock            clock;
    private final List<String>     allowlist;
    private final int              defaultTimeoutSeconds;

    @Autowired
    public CommandStepExecutor(SubprocessRunner processes, Clock clock,
                               @Value("${agentflow.command.allowlist}") List<String> allowlist,
                               @Value("${agentflow.command.default-timeout-seconds:300}") int defaultTimeoutSeconds) {
        this.processes             = processes;
        this.clock                 = clock;
        this.allowlist             = allowlist.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    @Override public StepType type() { return StepType.COMMAND; }

    @Override
    public StepResult execute(StepDefinition step, RunContext ctx) {
        Instant start = clock.instant();
        RunDirectory dir = ctx.runDirectory();
        int timeout = step.timeoutSeconds() != null ? step.timeoutSeconds() : defaultTimeoutSeconds;
        PolicyEnforcer enforcer = new PolicyEnforcer(
                new Policy(timeout, 0, 0, List.of(), allowlist), ctx.workspaceRoot());

        // appended from the subprocess reader thread
        StringBuffer output = new StringBuffer();
        output.append("$ ").append(step.command()).append('\n');

        PolicyDecision decision = enforcer.checkCommand(step.command());
        if (!decision.allowed()) {
            output.append("DENIED: ").append(decision.reason()).append('\n');
            String ref = finish(step, dir, output, start, null, false, enforcer);
            return StepResult.failed(step.id(), FailureKind.POLICY_VIOLATION, null, start, clock.instant(), ref,
                    "Command denied: " + decision.reason());
        }

        ProcessOutcome outcome;
        try {
            outcome = processes.run(ProcessSpec.shell(step.command(), ctx.workspaceRoot(),
                    Duration.ofSeconds(timeout)), line -> output.append(line).append('\n'));
        } catch (IOException e) {
            throw new StepExecutionException("Could not start shell for step '" + step.id() + "': "
                    + e.getMessage(), e);
        }

        output.append("\nexit code: ").append(outcome.exitCode() == null ? "none" : outcome.exitCode()).append('\n');
        if (outcome.timedOut()) {
            output.append("timed out after ").append(timeout).append("s\n");
        }
        String ref = finish(step, dir, output, start, outcome.exitCode(), outcome.timedOut(), enforcer);
        Instant end = clock.instant();

        if (outcome.timedOut()) {
            return StepResult.failed(step.id(), FailureKind.TIMEOUT, outcome.exitCode(), start, end, ref,
                    "Command timed out after " + timeout + "s");
        }
        if (!outcome.succeeded()) {
            return StepResult.failed(step.id(), FailureKind.NON_ZERO_EXIT, outcome.exitCode(), start, end, ref,
                    "Command exited with code " + outcome.exitCode());
        }
        log.info("Command step {} exited 0 in {}ms", step.id(), outcome.duration().toMillis());
        return StepResult.completed(step.id(), outcome.exitCode(), start, end, ref);
    }

    private String finish(StepDefinition step, RunDirectory dir, StringBuffer output, Instant start,
                          Integer exitCode, boolean timedOut, PolicyEnforcer enforcer) {
        String ref = dir.writeText(step.id(), ArtifactType.OUTPUT, output.toString());
        dir.writeJson(step.id(), ArtifactType.METRICS, StepMetrics.of(step.id(), type().yamlName(),
                Duration.between(start, clock.instant()), exitCode, timedOut, enforcer));
        return ref;
    }
}
