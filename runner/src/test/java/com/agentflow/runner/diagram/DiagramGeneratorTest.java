package com.agentflow.runner.diagram;

import com.agentflow.runner.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentflow.runner.TestFixtures.agent;
import static com.agentflow.runner.TestFixtures.applyDiff;
import static com.agentflow.runner.TestFixtures.cmd;
import static com.agentflow.runner.TestFixtures.policy;
import static com.agentflow.runner.TestFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;

class DiagramGeneratorTest {

    private final DiagramGenerator generator = new DiagramGenerator();

    private final WorkflowDefinition wf = workflow(
            cmd("lint", "npm run lint"),
            agent("fix", policy(10, 2, List.of("src/**"), List.of())),
            applyDiff("apply", true, null));

    private static long count(String text, String needle) {
        return text.lines().filter(l -> l.contains(needle)).count();
    }

    @Test
    void dot_threeStepsGiveThreeNodesAndTwoEdges() {
        String dot = generator.generate(wf, DiagramFormat.DOT);

        assertThat(dot).startsWith("digraph workflow {\n").endsWith("}\n");
        assertThat(count(dot, "[label=")).isEqualTo(3);
        assertThat(count(dot, " -> ")).isEqualTo(2);
        assertThat(dot).contains("\"lint\" -> \"fix\"").contains("\"fix\" -> \"apply\"");
        assertThat(dot).contains("\"fix\" [label=\"fix\\n(agent)\", shape=diamond, fillcolor=orange");
        assertThat(dot).contains("label=\"test-workflow\"");
    }

    @Test
    void mermaid_threeStepsGiveThreeNodesAndTwoEdges() {
        String mmd = generator.generate(wf, DiagramFormat.MERMAID);

        assertThat(mmd).contains("flowchart TD\n");
        assertThat(count(mmd, ":::")).isEqualTo(3);
        assertThat(count(mmd, " --> ")).isEqualTo(2);
        assertThat(mmd).contains("    s1{\"fix<br/>(agent)\"}:::agent\n");
        assertThat(mmd).contains("    s2{{\"apply<br/>(apply_diff)\"}}:::apply_diff\n");
    }

    @Test
    void generate_sameDefinition_sameOutput() {
        assertThat(generator.generate(wf, DiagramFormat.DOT)).isEqualTo(generator.generate(wf, DiagramFormat.DOT));
    }

    @Test
    void parse_acceptsNameOrExtension() {
        assertThat(DiagramFormat.parse("mermaid")).contains(DiagramFormat.MERMAID);
        assertThat(DiagramFormat.parse("mmd")).contains(DiagramFormat.MERMAID);
        assertThat(DiagramFormat.parse("DOT")).contains(DiagramFormat.DOT);
        assertThat(DiagramFormat.parse("svg")).isEmpty();
    }
}
