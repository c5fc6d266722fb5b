package com.agentflow.runner.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Launches step subprocesses with stdout and stderr merged.
 */
@Component
public class SubprocessRunner {

    private static final Logger log = LoggerFactory.getLogger(SubprocessRunner.class);

    private final Clock    clock;
    private final Duration gracePeriod;

    @Autowired
    public SubprocessRunner(Clock clock,
                            @Value("${agentflow.agent.grace-period-seconds:5}") long gracePeriodSeconds) {
        this(clock, Duration.ofSeconds(gracePeriodSeconds));
    }

    public SubprocessRunner(Clock clock, Duration gracePeriod) {
        this.clock       = clock;
        this.gracePeriod = gracePeriod;
    }

    /**
     * Spawn the process and start streaming its output to {@code handler}.
     *
     * @throws IOException if the executable cannot be started
     */
    public SubprocessSession start(ProcessSpec spec, OutputHandler handler) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(spec.command())
                .directory(spec.workingDirectory().toFile())
                .redirectErrorStream(true);
        Map<String, String> env = builder.environment();
        env.putAll(spec.environment());

        Process process = builder.start();
        log.debug("Spawned subprocess {}: {}", process.pid(), spec.command().get(0));
        return new SubprocessSession(process, spec, clock, gracePeriod, handler);
    }

    /** Spawn and wait. */
    public ProcessOutcome run(ProcessSpec spec, Consumer<String> lineSink) throws IOException {
        return start(spec, (line, session) -> lineSink.accept(line)).await();
    }
}
