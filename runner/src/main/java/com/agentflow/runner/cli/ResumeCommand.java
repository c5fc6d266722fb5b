package com.agentflow.runner.cli;

import com.agentflow.runner.service.ResumeException;
import com.agentflow.runner.service.RunOptions;
import com.agentflow.runner.service.RunOutcome;
import com.agentflow.runner.service.WorkflowRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(name = "resume", description = "Continue a failed run from a given step.")
public class ResumeCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "RUN_ID", description = "Id of the run to resume")
    String runId;

    @Option(names = "--from", paramLabel = "STEP", description = "Step to resume from (default: first incomplete step)")
    String fromStep;

    @Option(names = "--approve-all", description = "Treat every apply_diff step as approved")
    boolean approveAll;

    @Option(names = "--artifacts-dir", paramLabel = "DIR", description = "Directory the run was written to")
    Path artifactsDir;

    private final WorkflowRunner runner;

    public ResumeCommand(WorkflowRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RunOutcome outcome = runner.resume(runId, fromStep, new RunOptions(artifactsDir, approveAll),
                    new ConsoleProgressListener(out));
            return outcome.succeeded() ? ExitCodes.OK : ExitCodes.FAIL;
        } catch (ResumeException e) {
            err.println("Cannot resume: " + e.getMessage());
            return ExitCodes.FAIL;
        }
    }
}
