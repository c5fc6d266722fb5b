package com.agentflow.runner.cli;

import com.agentflow.runner.workflow.WorkflowScaffolder;
import com.agentflow.runner.workflow.WorkflowScaffolder.Template;
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
@Command(name = "scaffold", description = "Create a starter workflow from a template.")
public class ScaffoldCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "NAME", description = "Name of the new workflow")
    String name;

    @Option(names = "--template", paramLabel = "TEMPLATE", defaultValue = "basic",
            description = "basic, agent or test-grader (default: ${DEFAULT-VALUE})")
    String template;

    @Option(names = "--dir", paramLabel = "DIR", defaultValue = "workflows",
            description = "Parent directory (default: ${DEFAULT-VALUE})")
    Path baseDir;

    private final WorkflowScaffolder scaffolder;

    public ScaffoldCommand(WorkflowScaffolder scaffolder) {
        this.scaffolder = scaffolder;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Template tpl;
        try {
            tpl = Template.parse(template);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return ExitCodes.USAGE;
        }
        Path dir;
        try {
            dir = scaffolder.scaffold(name, tpl, baseDir);
        } catch (IllegalStateException e) {
            err.println("Cannot scaffold: " + e.getMessage());
            return ExitCodes.FAIL;
        }
        out.println("Scaffolded " + tpl.id() + " workflow in " + dir);
        out.println("Next steps:");
        out.println("  1. Edit " + dir.resolve("prompt.md"));
        out.println("  2. agentflow validate " + dir.resolve("workflow.yml"));
        out.println("  3. agentflow run " + dir.resolve("workflow.yml"));
        return ExitCodes.OK;
    }
}
