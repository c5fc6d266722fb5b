package com.agentflow.runner.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli once the context is up and keeps
 * the exit code for {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final AgentflowCommand command;
    private final IFactory         factory;
    private int                    exitCode;

    public CliRunner(AgentflowCommand command, IFactory factory) {
        this.command = command;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.error("Command failed", e);
                    cmd.getErr().println("error: " + e.getMessage());
                    return ExitCodes.FAIL;
                });
    }
}
