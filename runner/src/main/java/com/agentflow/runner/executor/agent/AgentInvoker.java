package com.agentflow.runner.executor.agent;

import com.agentflow.runner.artifact.TranscriptWriter;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutionException;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.policy.PolicyEnforcer;
import com.agentflow.runner.process.ProcessOutcome;
import com.agentflow.runner.process.ProcessSpec;
import com.agentflow.runner.process.SubprocessRunner;
import com.agentflow.runner.workflow.Placeholders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Runs the coding agent as a subprocess and polices its tool use.
 *
 * Command line:
 * <pre>
 *   &lt;executable&gt; [extra-args] -p --output-format stream-json --verbose [--model M] [--allowedTools T,...]
 * </pre>
 * The prompt goes to stdin. Every output line is appended to the step
 * transcript; tool-use events are checked by the step's
 * {@link PolicyEnforcer}, and the first denial terminates the agent.
 */
@Component
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    static final int TAIL_LINES = 50;

    private final SubprocessRunner      processes;
    private final String                executable;
    private final List<String>          extraArgs;
    private final UnaryOperator<String> env;

    @Autowired
    public AgentInvoker(SubprocessRunner processes,
                        @Value("${agentflow.agent.executable:claude}") String executable,
                        @Value("${agentflow.agent.extra-args:}") List<String> extraArgs) {
        this(processes, executable, extraArgs, System::getenv);
    }

    public AgentInvoker(SubprocessRunner processes, String executable, List<String> extraArgs,
                        UnaryOperator<String> env) {
        this.processes  = processes;
        this.executable = executable;
        this.extraArgs  = extraArgs == null ? List.of()
                : extraArgs.stream().filter(a -> !a.isBlank()).toList();
        this.env        = env;
    }

    /**
     * @throws StepExecutionException if the agent executable cannot be started
     */
    public AgentRun invoke(AgentRequest request, PolicyEnforcer enforcer, TranscriptWriter transcript) {
        ProcessSpec spec = spec(request);
        Deque<String> tail = new ArrayDeque<>();
        AtomicReference<String>         result = new AtomicReference<>();
        AtomicReference<PolicyDecision> denial = new AtomicReference<>();

        ProcessOutcome outcome;
        try {
            outcome = processes.start(spec, (line, session) -> {
                transcript.appendLine(line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > TAIL_LINES) tail.removeFirst();
                }
                for (AgentEvent event : AgentEventParser.parse(line)) {
                    if (event.kind() == AgentEvent.Kind.RESULT) {
                        result.set(event.text());
                    } else if (event.needsPolicyCheck() && denial.get() == null) {
                        PolicyDecision decision = check(enforcer, event);
                        if (!decision.allowed()) {
                            denial.set(decision);
                            transcript.appendLine("> DENIED " + event.tool() + " (" + decision.operation()
                                    + "): " + decision.reason());
                            session.terminate("policy violation: " + decision.reason());
                        }
                    }
                }
            }).await();
        } catch (IOException e) {
            throw new StepExecutionException("Could not start agent executable '" + executable
                    + "': " + e.getMessage(), e);
        }

        log.info("Agent exited: state={} exitCode={} duration={}ms",
                outcome.state(), outcome.exitCode(), outcome.duration().toMillis());
        List<String> tailCopy;
        synchronized (tail) {
            tailCopy = new ArrayList<>(tail);
        }
        return new AgentRun(outcome, result.get(), denial.get(), tailCopy);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    ProcessSpec spec(AgentRequest request) {
        RunContext ctx = request.context();
        WorkflowDefinition workflow = ctx.workflow();
        String model = resolveModel(workflow);

        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(extraArgs);
        command.addAll(List.of("-p", "--output-format", "stream-json", "--verbose"));
        if (model != null) {
            command.addAll(List.of("--model", model));
        }
        if (!request.allowedTools().isEmpty()) {
            command.addAll(List.of("--allowedTools", String.join(",", request.allowedTools())));
        }

        Map<String, String> environment = new HashMap<>();
        if (model != null) {
            environment.put("ANTHROPIC_MODEL", model);
            environment.put("AGENTFLOW_MODEL_ID", model);
        }
        environment.put("AGENTFLOW_GUARDRAILS", String.join(",", workflow.guardrailIds()));
        environment.put("AGENTFLOW_RUN_ID", ctx.runId());
        environment.put("AGENTFLOW_STEP_ID", request.stepId());
        if (workflow.runtimeLimits().seed() != null) {
            environment.put("AGENTFLOW_SEED", String.valueOf(workflow.runtimeLimits().seed()));
        }

        return new ProcessSpec(command, ctx.workspaceRoot(), environment, request.prompt(), request.timeout());
    }

    /** Workflow model with placeholders expanded, else {@code BEDROCK_MODEL_ID}, else none. */
    String resolveModel(WorkflowDefinition workflow) {
        String model = workflow.modelIdentifier();
        if (model != null) {
            model = Placeholders.expand(model, env);
            if (Placeholders.hasPlaceholder(model)) {
                log.warn("Model identifier '{}' has unset placeholders; falling back to BEDROCK_MODEL_ID", model);
                model = null;
            }
        }
        if (model == null || model.isBlank()) {
            model = env.apply("BEDROCK_MODEL_ID");
        }
        return model == null || model.isBlank() ? null : model;
    }

    private static PolicyDecision check(PolicyEnforcer enforcer, AgentEvent event) {
        return switch (event.operation()) {
            case READ    -> enforcer.checkRead(event.target());
            case EDIT    -> enforcer.checkEdit(event.target());
            case COMMAND -> enforcer.checkCommand(event.target());
        };
    }
}
