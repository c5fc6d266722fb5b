package com.agentflow.runner.cli;

import com.agentflow.runner.TestFixtures;
import com.agentflow.runner.artifact.ArtifactStore;
import com.agentflow.runner.artifact.RunIdGenerator;
import com.agentflow.runner.config.ObjectMappers;
import com.agentflow.runner.diagram.DiagramGenerator;
import com.agentflow.runner.executor.StepExecutorRegistry;
import com.agentflow.runner.executor.impl.CommandStepExecutor;
import com.agentflow.runner.process.SubprocessRunner;
import com.agentflow.runner.service.RunStateManager;
import com.agentflow.runner.service.WorkflowRunner;
import com.agentflow.runner.workflow.WorkflowLoader;
import com.agentflow.runner.workflow.WorkflowScaffolder;
import com.agentflow.runner.workflow.WorkflowValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.agentflow.runner.TestFixtures.read;
import static com.agentflow.runner.TestFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the CLI through picocli exactly as {@link CliRunner} does, with the
 * subcommands built by hand instead of by Spring.
 */
class AgentflowCommandTest {

    private static final String FAILING = """
            version: 1
            workflow: failing
            model: m
            steps:
              - id: ok
                type: cmd
                command: echo fine
              - id: fail
                type: cmd
                command: exit 1
            """;

    @TempDir Path tmp;

    Path runs;
    Path workspace;
    StringWriter out;
    StringWriter err;
    CommandLine cli;

    @BeforeEach
    void setUp() throws Exception {
        runs = tmp.resolve("runs");
        workspace = Files.createDirectories(tmp.resolve("ws"));
        Clock clock = Clock.systemUTC();

        SubprocessRunner processes = new SubprocessRunner(clock, Duration.ofMillis(500));
        StepExecutorRegistry registry = new StepExecutorRegistry(List.of(
                new CommandStepExecutor(processes, clock, List.of("echo", "exit", "test"), 30)), new SimpleMeterRegistry());
        WorkflowLoader loader = new WorkflowLoader(new WorkflowValidator(ObjectMappers.yaml(), name -> null));
        ArtifactStore artifacts = TestFixtures.artifactStore(runs);
        WorkflowRunner runner = new WorkflowRunner(loader, artifacts, new RunIdGenerator(clock),
                new RunStateManager(clock), registry, clock, workspace);

        Map<Class<?>, Object> commands = Map.of(
                ValidateCommand.class, new ValidateCommand(loader),
                RunCommand.class,      new RunCommand(runner),
                ResumeCommand.class,   new ResumeCommand(runner),
                DiagramCommand.class,  new DiagramCommand(loader, new DiagramGenerator()),
                ScaffoldCommand.class, new ScaffoldCommand(new WorkflowScaffolder()));
        IFactory factory = new IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                Object prebuilt = commands.get(cls);
                return prebuilt != null ? cls.cast(prebuilt) : CommandLine.defaultFactory().create(cls);
            }
        };

        out = new StringWriter();
        err = new StringWriter();
        cli = new CliRunner(new AgentflowCommand(), factory).commandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    private int execute(String... args) {
        return cli.execute(args);
    }

    // ------------------------------------------------------------------
    // run / resume
    // ------------------------------------------------------------------

    @Test
    void run_failingCommand_exitsOneAndPrintsResumeCommandToStdout() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        int code = execute("run", file.toString());

        assertThat(code).isEqualTo(1);
        String stdout = out.toString();
        assertThat(stdout).contains("[1/2] ok (cmd)").contains("[2/2] fail (cmd)")
                .contains("failed at step 'fail': Command exited with code 1");
        Matcher m = Pattern.compile("Resume with: agentflow resume (\\S+) --from fail\\R").matcher(stdout);
        assertThat(m.find()).as(stdout).isTrue();
        assertThat(runs.resolve(m.group(1)).resolve("run-state.json")).exists();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void run_customArtifactsDir_printedResumeCommandWorks() {
        Path file = write(tmp.resolve("gated.yml"), """
                version: 1
                workflow: gated
                model: m
                steps:
                  - id: gate
                    type: cmd
                    command: test -f ready.txt
                """);
        Path custom = tmp.resolve("custom");

        assertThat(execute("run", "--artifacts-dir", custom.toString(), file.toString())).isEqualTo(1);

        Matcher m = Pattern.compile("Resume with: agentflow (resume .*)").matcher(out.toString());
        assertThat(m.find()).as(out.toString()).isTrue();
        String[] resumeArgs = m.group(1).trim().split(" ");
        assertThat(resumeArgs).containsSubsequence("--artifacts-dir", custom.toAbsolutePath().normalize().toString());

        write(workspace.resolve("ready.txt"), "yes");
        out.getBuffer().setLength(0);

        assertThat(execute(resumeArgs)).as(err.toString()).isZero();
        assertThat(out.toString()).contains("completed");
        assertThat(err.toString()).doesNotContain("Cannot resume");
    }

    @Test
    void run_successfulWorkflow_exitsZero() {
        Path file = write(tmp.resolve("ok.yml"), FAILING.replace("exit 1", "echo also fine"));

        assertThat(execute("run", file.toString())).isZero();
        assertThat(out.toString()).contains("completed");
    }

    @Test
    void run_dryRun_printsPlanWithoutArtifacts() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        int code = execute("run", "--dry-run", file.toString());

        assertThat(code).isZero();
        assertThat(out.toString()).contains("1. ok [cmd] $ echo fine").contains("2. fail [cmd] $ exit 1");
        assertThat(runs).doesNotExist();
    }

    @Test
    void run_artifactsDirOption_overridesDefault() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        execute("run", "--artifacts-dir", tmp.resolve("custom").toString(), file.toString());

        assertThat(tmp.resolve("custom")).isDirectory();
        assertThat(runs).doesNotExist();
    }

    @Test
    void run_invalidWorkflow_exitsOneWithViolations() {
        Path file = write(tmp.resolve("bad.yml"), FAILING.replace("    command: exit 1\n", ""));

        int code = execute("run", file.toString());

        assertThat(code).isEqualTo(1);
        assertThat(err.toString()).contains("is invalid").contains("Step 'fail'");
        assertThat(runs).doesNotExist();
    }

    @Test
    void resume_unknownRun_exitsOne() {
        int code = execute("resume", "2026-01-01T00-00-00-zzzzzz");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot resume: No run '2026-01-01T00-00-00-zzzzzz'");
    }

    // ------------------------------------------------------------------
    // validate / diagram / scaffold
    // ------------------------------------------------------------------

    @Test
    void validate_validFile_printsSummary() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        assertThat(execute("validate", file.toString())).isZero();
        assertThat(out.toString()).contains("is valid").contains("steps:      2 (ok, fail)");
    }

    @Test
    void validate_missingFile_exitsOne() {
        assertThat(execute("validate", tmp.resolve("missing.yml").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("file not found");
    }

    @Test
    void diagram_defaultsToDotNextToWorkflow() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        assertThat(execute("diagram", file.toString())).isZero();

        assertThat(read(tmp.resolve("failing-diagram.dot"))).contains("\"ok\" -> \"fail\"");
    }

    @Test
    void diagram_mermaidToExplicitOutput() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);
        Path target = tmp.resolve("out/flow.mmd");

        assertThat(execute("diagram", "--format", "mermaid", "-o", target.toString(), file.toString())).isZero();
        assertThat(read(target)).contains("flowchart TD");
    }

    @Test
    void diagram_unknownFormat_usageError() {
        Path file = write(tmp.resolve("failing.yml"), FAILING);

        assertThat(execute("diagram", "--format", "svg", file.toString())).isEqualTo(2);
    }

    @Test
    void scaffold_thenValidate_roundTrip() {
        int code = execute("scaffold", "Nightly Fix", "--template", "agent", "--dir", tmp.toString());

        assertThat(code).isZero();
        Path workflow = tmp.resolve("nightly-fix/workflow.yml");
        assertThat(workflow).exists();
        assertThat(execute("validate", workflow.toString())).isZero();
        assertThat(execute("scaffold", "Nightly Fix", "--dir", tmp.toString())).isEqualTo(1);
    }

    @Test
    void noSubcommand_printsUsage() {
        assertThat(execute()).isEqualTo(2);
        assertThat(err.toString()).contains("Usage: agentflow");
    }
}
