package com.agentflow.runner.cli;

import com.agentflow.runner.diagram.DiagramFormat;
import com.agentflow.runner.diagram.DiagramGenerator;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.workflow.WorkflowLoader;
import com.agentflow.runner.workflow.WorkflowValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(name = "diagram", description = "Render a workflow as a Graphviz DOT or Mermaid diagram.")
public class DiagramCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Workflow YAML file")
    Path file;

    @Option(names = "--format", paramLabel = "FORMAT", defaultValue = "dot",
            description = "dot or mermaid (default: ${DEFAULT-VALUE})")
    String format;

    @Option(names = {"-o", "--output"}, paramLabel = "PATH",
            description = "Output file (default: <workflow>-diagram.<ext> next to the workflow)")
    Path output;

    private final WorkflowLoader   loader;
    private final DiagramGenerator generator;

    public DiagramCommand(WorkflowLoader loader, DiagramGenerator generator) {
        this.loader    = loader;
        this.generator = generator;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        DiagramFormat fmt = DiagramFormat.parse(format).orElse(null);
        if (fmt == null) {
            err.println("Unknown diagram format '" + format + "'; use dot or mermaid");
            return ExitCodes.USAGE;
        }
        WorkflowDefinition workflow;
        try {
            workflow = loader.load(file);
        } catch (WorkflowValidationException e) {
            err.println("Workflow " + file + " is invalid:");
            e.getViolations().forEach(v -> err.println("  - " + v.describe()));
            return ExitCodes.FAIL;
        }

        Path target = output != null ? output : defaultOutput(file, fmt);
        try {
            if (target.toAbsolutePath().getParent() != null) {
                Files.createDirectories(target.toAbsolutePath().getParent());
            }
            Files.writeString(target, generator.generate(workflow, fmt), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write diagram to " + target, e);
        }
        out.println("Diagram written to " + target);
        return ExitCodes.OK;
    }

    static Path defaultOutput(Path workflowFile, DiagramFormat format) {
        String name = workflowFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return workflowFile.resolveSibling(base + "-diagram." + format.extension());
    }
}
