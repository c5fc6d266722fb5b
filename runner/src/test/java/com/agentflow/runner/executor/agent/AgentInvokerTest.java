package com.agentflow.runner.executor.agent;

import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.model.RuntimeLimits;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.process.ProcessSpec;
import com.agentflow.runner.process.SubprocessRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.agentflow.runner.TestFixtures.cmd;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Command-line and environment construction for the agent subprocess.
 */
class AgentInvokerTest {

    @TempDir Path tmp;

    private final SubprocessRunner processes = new SubprocessRunner(Clock.systemUTC(), Duration.ofMillis(500));

    private RunContext context(String model, Long seed) {
        WorkflowDefinition wf = new WorkflowDefinition(1, "wf", model, List.of("pii-basic", "no-secrets"),
                new RuntimeLimits(null, null, seed), List.of(cmd("a", "true")));
        return new RunContext("run-1", wf, null, tmp, tmp, false);
    }

    @Test
    void spec_buildsStreamJsonCommandLine() {
        AgentInvoker invoker = new AgentInvoker(processes, "claude", List.of("--dangerously-x", " "), name -> null);
        AgentRequest request = new AgentRequest("edit", "do it", List.of("Read", "Edit"),
                Duration.ofSeconds(30), context("claude-sonnet", 7L));

        ProcessSpec spec = invoker.spec(request);

        assertThat(spec.command()).containsExactly("claude", "--dangerously-x", "-p",
                "--output-format", "stream-json", "--verbose",
                "--model", "claude-sonnet", "--allowedTools", "Read,Edit");
        assertThat(spec.stdin()).isEqualTo("do it");
        assertThat(spec.workingDirectory()).isEqualTo(tmp);
        assertThat(spec.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(spec.environment())
                .containsEntry("ANTHROPIC_MODEL", "claude-sonnet")
                .containsEntry("AGENTFLOW_GUARDRAILS", "pii-basic,no-secrets")
                .containsEntry("AGENTFLOW_RUN_ID", "run-1")
                .containsEntry("AGENTFLOW_STEP_ID", "edit")
                .containsEntry("AGENTFLOW_SEED", "7");
    }

    @Test
    void resolveModel_expandsPlaceholders() {
        AgentInvoker invoker = new AgentInvoker(processes, "claude", List.of(),
                Map.of("MODEL_VERSION", "4")::get);

        assertThat(invoker.resolveModel(context("claude-v${MODEL_VERSION}", null).workflow()))
                .isEqualTo("claude-v4");
    }

    @Test
    void resolveModel_unsetPlaceholder_fallsBackToBedrockModelId() {
        AgentInvoker invoker = new AgentInvoker(processes, "claude", List.of(),
                Map.of("BEDROCK_MODEL_ID", "bedrock-model")::get);

        assertThat(invoker.resolveModel(context("${UNSET}", null).workflow())).isEqualTo("bedrock-model");
        assertThat(invoker.resolveModel(context(null, null).workflow())).isEqualTo("bedrock-model");
    }

    @Test
    void spec_noModelAnywhere_omitsModelFlag() {
        AgentInvoker invoker = new AgentInvoker(processes, "claude", List.of(), name -> null);

        ProcessSpec spec = invoker.spec(new AgentRequest("edit", "p", List.of(), Duration.ofSeconds(5),
                context(null, null)));

        assertThat(spec.command()).doesNotContain("--model", "--allowedTools");
        assertThat(spec.environment()).doesNotContainKeys("ANTHROPIC_MODEL", "AGENTFLOW_SEED");
    }
}
