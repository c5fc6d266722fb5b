package com.agentflow.runner.executor.agent;

import com.agentflow.runner.policy.Operation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentflow.runner.TestFixtures.resultLine;
import static com.agentflow.runner.TestFixtures.toolUse;
import static org.assertj.core.api.Assertions.assertThat;

class AgentEventParserTest {

    @Test
    void parse_editToolUse_mapsToEditOperation() {
        List<AgentEvent> events = AgentEventParser.parse(toolUse("Edit", "file_path", "src/App.java"));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.kind()).isEqualTo(AgentEvent.Kind.TOOL_USE);
            assertThat(e.operation()).isEqualTo(Operation.EDIT);
            assertThat(e.target()).isEqualTo("src/App.java");
            assertThat(e.needsPolicyCheck()).isTrue();
        });
    }

    @Test
    void parse_bashToolUse_targetIsCommandLine() {
        AgentEvent e = AgentEventParser.parse(toolUse("Bash", "command", "npm test")).get(0);

        assertThat(e.operation()).isEqualTo(Operation.COMMAND);
        assertThat(e.target()).isEqualTo("npm test");
    }

    @Test
    void parse_grepWithoutPath_needsNoCheck() {
        AgentEvent e = AgentEventParser.parse(toolUse("Grep", "pattern", "TODO")).get(0);

        assertThat(e.operation()).isEqualTo(Operation.READ);
        assertThat(e.target()).isNull();
        assertThat(e.needsPolicyCheck()).isFalse();
    }

    @Test
    void parse_unknownTool_hasNoOperation() {
        AgentEvent e = AgentEventParser.parse(toolUse("WebFetch", "url", "https://example.com")).get(0);

        assertThat(e.operation()).isNull();
        assertThat(e.needsPolicyCheck()).isFalse();
    }

    @Test
    void parse_mixedContentBlocks_keepOrder() {
        String line = """
                {"type":"assistant","message":{"content":[\
                {"type":"text","text":"Reading the file"},\
                {"type":"tool_use","name":"Read","input":{"file_path":"README.md"}}]}}""";

        List<AgentEvent> events = AgentEventParser.parse(line);

        assertThat(events).extracting(AgentEvent::kind)
                .containsExactly(AgentEvent.Kind.TEXT, AgentEvent.Kind.TOOL_USE);
        assertThat(events.get(0).text()).isEqualTo("Reading the file");
    }

    @Test
    void parse_resultLine_yieldsResultText() {
        assertThat(AgentEventParser.parse(resultLine("all done")))
                .singleElement()
                .satisfies(e -> assertThat(e.text()).isEqualTo("all done"));
    }

    @Test
    void parse_nonJsonAndIrrelevantLines_yieldNothing() {
        assertThat(AgentEventParser.parse("plain stderr noise")).isEmpty();
        assertThat(AgentEventParser.parse("{not json")).isEmpty();
        assertThat(AgentEventParser.parse("{\"type\":\"system\",\"subtype\":\"init\"}")).isEmpty();
        assertThat(AgentEventParser.parse(null)).isEmpty();
    }
}
