package com.agentflow.runner.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * One running subprocess and the thread that pumps its merged output.
 *
 * The state machine is driven by {@link #await()} on the caller's thread.
 * Output lines are delivered to the handler on a single daemon reader thread,
 * which may call {@link #terminate(String)} to stop the process early.
 *
 * <p>If an exit is observed before the deadline check, the process counts
 * as EXITED even when the clock has since moved past the deadline.
 */
public class SubprocessSession {

    private static final Logger log = LoggerFactory.getLogger(SubprocessSession.class);

    // Upper bound on one waitFor() slice so terminate requests and clock
    // changes are noticed promptly.
    private static final long POLL_MILLIS = 50;

    // How long await() waits for the reader to drain after the process is gone.
    private static final long READER_JOIN_MILLIS = 2_000;

    private final Process  process;
    private final Clock    clock;
    private final Duration gracePeriod;
    private final Instant  startedAt;
    private final Instant  deadline;
    private final Thread   reader;

    private volatile ProcessState state = ProcessState.SPAWNED;
    private volatile String       terminationReason;
    private volatile RuntimeException sinkFailure;

    SubprocessSession(Process process, ProcessSpec spec, Clock clock, Duration gracePeriod,
                      OutputHandler handler) {
        this.process     = process;
        this.clock       = clock;
        this.gracePeriod = gracePeriod;
        this.startedAt   = clock.instant();
        this.deadline    = startedAt.plus(spec.timeout());

        writeStdin(spec.stdin());

        this.reader = new Thread(() -> pump(handler), "subprocess-reader-" + process.pid());
        this.reader.setDaemon(true);
        this.state = ProcessState.STREAMING;
        this.reader.start();
    }

    public ProcessState state() { return state; }
    public long         pid()   { return process.pid(); }

    /**
     * Ask the process to stop. Safe to call from the reader thread; the first
     * reason wins.
     */
    public void terminate(String reason) {
        synchronized (this) {
            if (terminationReason != null || state.isFinal()) return;
            terminationReason = reason;
        }
        log.info("Terminating subprocess {}: {}", process.pid(), reason);
        stop();
    }

    /**
     * Block until the process exits, times out or is terminated, then drain
     * the reader.
     *
     * @throws RuntimeException whatever the output handler threw, after the process is stopped
     */
    public ProcessOutcome await() {
        ProcessState finalState = null;
        try {
            while (finalState == null) {
                if (process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    finalState = terminationReason != null ? ProcessState.TERMINATED : ProcessState.EXITED;
                } else if (terminationReason != null) {
                    // stop() already signalled; keep waiting for the exit
                    continue;
                } else if (!clock.instant().isBefore(deadline)) {
                    log.warn("Subprocess {} exceeded its {}s deadline", process.pid(),
                            Duration.between(startedAt, deadline).toSeconds());
                    stop();
                    finalState = ProcessState.TIMED_OUT;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            terminationReason = "interrupted";
            finalState = ProcessState.TERMINATED;
        }
        state = finalState;
        joinReader();

        if (sinkFailure != null) {
            throw sinkFailure;
        }
        Integer exitCode = process.isAlive() ? null : process.exitValue();
        return new ProcessOutcome(finalState, exitCode,
                Duration.between(startedAt, clock.instant()), terminationReason);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void writeStdin(String stdin) {
        try (OutputStream out = process.getOutputStream()) {
            if (stdin != null && !stdin.isEmpty()) {
                out.write(stdin.getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } catch (IOException e) {
            // the process may exit without reading its input; its output still matters
            log.debug("Could not write stdin of subprocess {}: {}", process.pid(), e.getMessage());
        }
    }

    private void pump(OutputHandler handler) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                handler.onLine(line, this);
            }
        } catch (IOException e) {
            log.debug("Output stream of subprocess {} closed: {}", process.pid(), e.getMessage());
        } catch (RuntimeException e) {
            sinkFailure = e;
            terminate("output handling failed: " + e.getMessage());
        }
    }

    /** SIGTERM the process tree, then SIGKILL whatever survives the grace period. */
    private void stop() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Subprocess {} ignored SIGTERM for {}s, killing it", process.pid(), gracePeriod.toSeconds());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void joinReader() {
        if (Thread.currentThread() == reader) return;
        try {
            reader.join(READER_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (reader.isAlive()) {
            log.warn("Output of subprocess {} still open after exit; abandoning reader", process.pid());
        }
    }
}
