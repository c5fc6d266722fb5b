package com.agentflow.runner.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * What to launch and how long it may run.
 *
 * @param environment extra variables layered over the inherited environment
 * @param stdin       written to the process and then closed; null sends nothing
 */
public record ProcessSpec(
        List<String>        command,
        Path                workingDirectory,
        Map<String, String> environment,
        String              stdin,
        Duration            timeout) {

    public ProcessSpec {
        command     = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    /** {@code sh -c <commandLine>} in the given directory. */
    public static ProcessSpec shell(String commandLine, Path workingDirectory, Duration timeout) {
        return new ProcessSpec(List.of("sh", "-c", commandLine), workingDirectory, Map.of(), null, timeout);
    }
}
