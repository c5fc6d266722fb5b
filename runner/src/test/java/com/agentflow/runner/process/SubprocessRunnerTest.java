package com.agentflow.runner.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real {@code sh} processes; each test finishes in well under a second
 * except the timeout cases, which are bounded by their own short deadlines.
 */
class SubprocessRunnerTest {

    @TempDir Path tmp;

    private final SubprocessRunner runner = new SubprocessRunner(Clock.systemUTC(), Duration.ofMillis(500));

    @Test
    void run_successfulCommand_exitedWithZero() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();

        ProcessOutcome outcome = runner.run(ProcessSpec.shell("echo hello", tmp, Duration.ofSeconds(10)), lines::add);

        assertThat(outcome.state()).isEqualTo(ProcessState.EXITED);
        assertThat(outcome.succeeded()).isTrue();
        assertThat(lines).containsExactly("hello");
    }

    @Test
    void run_nonZeroExit_reportsCode() throws Exception {
        ProcessOutcome outcome = runner.run(ProcessSpec.shell("exit 3", tmp, Duration.ofSeconds(10)), line -> {});

        assertThat(outcome.state()).isEqualTo(ProcessState.EXITED);
        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.succeeded()).isFalse();
    }

    @Test
    void run_stderrMergedIntoOutput() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();

        runner.run(ProcessSpec.shell("echo out; echo err 1>&2", tmp, Duration.ofSeconds(10)), lines::add);

        assertThat(lines).containsExactlyInAnyOrder("out", "err");
    }

    @Test
    void run_workingDirectoryStdinAndEnvironment_applied() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();
        ProcessSpec spec = new ProcessSpec(List.of("sh", "-c", "pwd; cat; echo \"$GREETING\""),
                tmp, Map.of("GREETING", "hi there"), "from stdin\n", Duration.ofSeconds(10));

        runner.run(spec, lines::add);

        assertThat(lines).containsExactly(tmp.toRealPath().toString(), "from stdin", "hi there");
    }

    @Test
    void run_pastDeadline_timedOutAndKilled() throws Exception {
        long start = System.nanoTime();

        ProcessOutcome outcome = runner.run(ProcessSpec.shell("sleep 30", tmp, Duration.ofMillis(300)), line -> {});

        assertThat(outcome.state()).isEqualTo(ProcessState.TIMED_OUT);
        assertThat(outcome.timedOut()).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void terminate_fromOutputHandler_stopsProcess() throws Exception {
        SubprocessSession session = runner.start(
                ProcessSpec.shell("echo go; sleep 30", tmp, Duration.ofSeconds(30)),
                (line, s) -> {
                    if (line.equals("go")) s.terminate("saw go");
                });

        ProcessOutcome outcome = session.await();

        assertThat(outcome.state()).isEqualTo(ProcessState.TERMINATED);
        assertThat(outcome.terminationReason()).isEqualTo("saw go");
        assertThat(outcome.duration()).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void await_handlerThrows_rethrownAfterStop() throws Exception {
        SubprocessSession session = runner.start(
                ProcessSpec.shell("echo boom; sleep 30", tmp, Duration.ofSeconds(30)),
                (line, s) -> {
                    throw new IllegalStateException("sink broke on " + line);
                });

        assertThatThrownBy(session::await)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("sink broke on boom");
    }

    @Test
    void start_missingExecutable_throwsIOException() {
        ProcessSpec spec = new ProcessSpec(List.of(tmp.resolve("no-such-binary").toString()),
                tmp, Map.of(), null, Duration.ofSeconds(1));

        assertThatThrownBy(() -> runner.start(spec, (line, s) -> {}))
                .isInstanceOf(IOException.class);
    }
}
