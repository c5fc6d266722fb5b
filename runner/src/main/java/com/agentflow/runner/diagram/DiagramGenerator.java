package com.agentflow.runner.diagram;

import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.model.WorkflowDefinition;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a workflow as a graph: one node per step, one edge between each
 * pair of consecutive steps. Depends only on the definition, never on a run.
 */
@Component
public class DiagramGenerator {

    public String generate(WorkflowDefinition workflow, DiagramFormat format) {
        return switch (format) {
            case DOT     -> dot(workflow);
            case MERMAID -> mermaid(workflow);
        };
    }

    // ------------------------------------------------------------------
    // Graphviz
    // ------------------------------------------------------------------

    private static String dot(WorkflowDefinition workflow) {
        StringBuilder sb = new StringBuilder("digraph workflow {\n");
        sb.append("  rankdir=TB;\n");
        sb.append("  node [shape=box, style=rounded];\n");
        sb.append("  bgcolor=\"white\";\n");
        sb.append("  fontname=\"Helvetica\";\n\n");
        sb.append("  label=\"").append(escape(workflow.name())).append("\";\n");
        sb.append("  labelloc=t;\n");
        sb.append("  fontsize=14;\n\n");

        for (StepDefinition step : workflow.steps()) {
            sb.append("  \"").append(step.id()).append("\" [label=\"").append(step.id())
              .append("\\n(").append(step.type().yamlName()).append(")\", shape=").append(dotShape(step.type()))
              .append(", fillcolor=").append(dotColor(step.type()))
              .append(", style=filled, fontname=\"Helvetica\"];\n");
        }
        sb.append('\n');

        List<StepDefinition> steps = workflow.steps();
        for (int i = 0; i + 1 < steps.size(); i++) {
            sb.append("  \"").append(steps.get(i).id()).append("\" -> \"").append(steps.get(i + 1).id())
              .append("\" [color=gray, penwidth=2];\n");
        }
        return sb.append("}\n").toString();
    }

    private static String dotShape(StepType type) {
        return switch (type) {
            case AGENT      -> "diamond";
            case APPLY_DIFF -> "octagon";
            default         -> "box";
        };
    }

    private static String dotColor(StepType type) {
        return switch (type) {
            case COMMAND    -> "lightblue";
            case AGENT      -> "orange";
            case APPLY_DIFF -> "lightcoral";
            case PROMPT     -> "lightgreen";
            case CUSTOM     -> "lightyellow";
        };
    }

    private static String escape(String text) {
        return text == null ? "Workflow" : text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // ------------------------------------------------------------------
    // Mermaid
    // ------------------------------------------------------------------

    private static String mermaid(WorkflowDefinition workflow) {
        StringBuilder sb = new StringBuilder();
        sb.append("---\ntitle: ").append(workflow.name() == null ? "Workflow" : workflow.name()).append("\n---\n");
        sb.append("flowchart TD\n");

        List<StepDefinition> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            String label = "\"" + step.id() + "<br/>(" + step.type().yamlName() + ")\"";
            String node = switch (step.type()) {
                case AGENT      -> "{" + label + "}";
                case APPLY_DIFF -> "{{" + label + "}}";
                default         -> "[" + label + "]";
            };
            sb.append("    s").append(i).append(node).append(":::").append(step.type().yamlName()).append('\n');
        }
        for (int i = 0; i + 1 < steps.size(); i++) {
            sb.append("    s").append(i).append(" --> s").append(i + 1).append('\n');
        }
        for (StepType type : StepType.values()) {
            sb.append("    classDef ").append(type.yamlName()).append(" fill:")
              .append(mermaidColor(type)).append(",stroke:#888\n");
        }
        return sb.toString();
    }

    private static String mermaidColor(StepType type) {
        return switch (type) {
            case COMMAND    -> "#add8e6";
            case AGENT      -> "#ffa500";
            case APPLY_DIFF -> "#f08080";
            case PROMPT     -> "#90ee90";
            case CUSTOM     -> "#ffffe0";
        };
    }
}
