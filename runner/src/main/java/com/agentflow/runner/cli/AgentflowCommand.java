package com.agentflow.runner.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level command. Subcommands:
 * <ul>
 *   <li>{@code validate} check a workflow file without running it</li>
 *   <li>{@code run} execute a workflow</li>
 *   <li>{@code resume} continue a failed run</li>
 *   <li>{@code diagram} render a workflow as DOT or Mermaid</li>
 *   <li>{@code scaffold} write a starter workflow</li>
 * </ul>
 */
@Component
@Command(
        name = "agentflow",
        mixinStandardHelpOptions = true,
        version = "agentflow 0.1.0",
        description = "Runs declarative coding-agent workflows under least-privilege policies.",
        subcommands = {
            ValidateCommand.class,
            RunCommand.class,
            ResumeCommand.class,
            DiagramCommand.class,
            ScaffoldCommand.class
        })
public class AgentflowCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    /** Without a subcommand there is nothing to do. */
    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.USAGE;
    }
}
