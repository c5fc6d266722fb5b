package com.agentflow.runner.cli;

import com.agentflow.runner.service.RunOptions;
import com.agentflow.runner.service.RunOutcome;
import com.agentflow.runner.service.WorkflowRunner;
import com.agentflow.runner.workflow.WorkflowValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Component
@Command(name = "run", description = "Execute a workflow.")
public class RunCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Workflow YAML file")
    Path file;

    @Option(names = "--dry-run", description = "Validate and print the plan without executing anything")
    boolean dryRun;

    @Option(names = "--approve-all", description = "Treat every apply_diff step as approved")
    boolean approveAll;

    @Option(names = "--artifacts-dir", paramLabel = "DIR", description = "Directory for run artifacts")
    Path artifactsDir;

    private final WorkflowRunner runner;

    public RunCommand(WorkflowRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            if (dryRun) {
                List<String> plan = runner.dryRun(file);
                out.println("Dry run of " + file + " (" + plan.size() + " steps, nothing executed):");
                plan.forEach(line -> out.println("  " + line));
                return ExitCodes.OK;
            }
            RunOutcome outcome = runner.run(file, new RunOptions(artifactsDir, approveAll),
                    new ConsoleProgressListener(out));
            return outcome.succeeded() ? ExitCodes.OK : ExitCodes.FAIL;
        } catch (WorkflowValidationException e) {
            err.println("Workflow " + file + " is invalid:");
            e.getViolations().forEach(v -> err.println("  - " + v.describe()));
            return ExitCodes.FAIL;
        }
    }
}
