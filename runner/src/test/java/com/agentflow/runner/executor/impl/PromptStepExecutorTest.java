package com.agentflow.runner.executor.impl;

import com.agentflow.runner.TestFixtures;
import com.agentflow.runner.artifact.ArtifactType;
import com.agentflow.runner.config.ObjectMappers;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.agent.AgentInvoker;
import com.agentflow.runner.executor.agent.PromptRenderer;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepStatus;
import com.agentflow.runner.process.SubprocessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.agentflow.runner.TestFixtures.fakeAgent;
import static com.agentflow.runner.TestFixtures.prompt;
import static com.agentflow.runner.TestFixtures.resultLine;
import static com.agentflow.runner.TestFixtures.toolUse;
import static com.agentflow.runner.TestFixtures.workflow;
import static com.agentflow.runner.TestFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;

class PromptStepExecutorTest {

    @TempDir Path tmp;

    private PromptStepExecutor executor(String scriptBody) {
        Path script = fakeAgent(tmp, scriptBody);
        SubprocessRunner processes = new SubprocessRunner(Clock.systemUTC(), Duration.ofMillis(500));
        AgentInvoker invoker = new AgentInvoker(processes, script.toString(), List.of(), name -> null);
        return new PromptStepExecutor(invoker, new PromptRenderer(), Clock.systemUTC(), 50, 30);
    }

    @Test
    void execute_writesReadOnlyPolicyScopedToInputs() throws Exception {
        Path ws = tmp.resolve("ws");
        write(ws.resolve("ask.md"), "What does this do?");
        write(ws.resolve("src/a.ts"), "export {}");
        StepDefinition step = prompt("ask", "ask.md", Map.of("paths", List.of("src/**")));
        RunContext ctx = TestFixtures.context(ws, tmp.resolve("runs"), "run-1", workflow(step));

        StepResult result = executor("cat > /dev/null\necho '" + resultLine("It exports nothing.") + "'")
                .execute(step, ctx);

        assertThat(result.status()).isEqualTo(StepStatus.COMPLETED);
        JsonNode policy = ObjectMappers.json().readTree(
                ctx.runDirectory().readText("ask", ArtifactType.POLICY).orElseThrow());
        assertThat(policy.get("max_edits").asInt()).isZero();
        assertThat(policy.get("cmd_allowlist")).isEmpty();
        assertThat(policy.get("allowed_paths").get(0).asText()).isEqualTo("src/**");
        assertThat(ctx.runDirectory().readText("ask", ArtifactType.OUTPUT)).contains("It exports nothing.\n");
    }

    @Test
    void execute_agentAttemptsEdit_deniedByReadOnlyPolicy() {
        Path ws = tmp.resolve("ws");
        write(ws.resolve("ask.md"), "Summarise.");
        StepDefinition step = prompt("ask", "ask.md", null);
        RunContext ctx = TestFixtures.context(ws, tmp.resolve("runs"), "run-1", workflow(step));

        StepResult result = executor(String.join("\n",
                "cat > /dev/null",
                "echo '" + toolUse("Write", "file_path", "notes.md") + "'",
                "sleep 30")).execute(step, ctx);

        assertThat(result.failureKind()).isEqualTo(FailureKind.POLICY_VIOLATION);
        assertThat(result.errorMessage()).contains("max_edits=0");
    }
}
