package com.agentflow.runner.executor.agent;

import com.agentflow.runner.policy.Operation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the agent's {@code --output-format stream-json} lines.
 *
 * Each line is one JSON object. The ones that matter:
 * <pre>
 *   {"type":"assistant","message":{"content":[{"type":"tool_use","name":"Edit","input":{"file_path":"src/A.java",...}}]}}
 *   {"type":"assistant","message":{"content":[{"type":"text","text":"..."}]}}
 *   {"type":"result","subtype":"success","result":"final answer"}
 * </pre>
 * Anything else, including lines that are not JSON, yields no events.
 */
public class AgentEventParser {

    private static final ObjectMapper JSON = new ObjectMapper();

    static final Map<String, Operation> TOOL_OPERATIONS = Map.of(
            "Read",         Operation.READ,
            "Glob",         Operation.READ,
            "Grep",         Operation.READ,
            "LS",           Operation.READ,
            "Edit",         Operation.EDIT,
            "Write",        Operation.EDIT,
            "MultiEdit",    Operation.EDIT,
            "NotebookEdit", Operation.EDIT,
            "Bash",         Operation.COMMAND);

    /** Tools allowed for read-only (prompt) steps. */
    public static final List<String> READ_ONLY_TOOLS = List.of("Read", "Glob", "Grep", "LS");

    private AgentEventParser() {}

    public static List<AgentEvent> parse(String line) {
        if (line == null || !line.startsWith("{")) return List.of();
        JsonNode node;
        try {
            node = JSON.readTree(line);
        } catch (JsonProcessingException e) {
            return List.of();
        }
        return switch (node.path("type").asText()) {
            case "assistant" -> assistantEvents(node.path("message").path("content"));
            case "result"    -> node.hasNonNull("result")
                    ? List.of(AgentEvent.result(node.get("result").asText()))
                    : List.of();
            default -> List.of();
        };
    }

    private static List<AgentEvent> assistantEvents(JsonNode content) {
        if (!content.isArray()) return List.of();
        List<AgentEvent> events = new ArrayList<>();
        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "tool_use" -> events.add(toolUse(block.path("name").asText(), block.path("input")));
                case "text"     -> events.add(AgentEvent.text(block.path("text").asText()));
                default -> { }
            }
        }
        return events;
    }

    private static AgentEvent toolUse(String tool, JsonNode input) {
        Operation op = TOOL_OPERATIONS.get(tool);
        String target = switch (tool) {
            case "Read", "Edit", "Write", "MultiEdit" -> text(input, "file_path");
            case "NotebookEdit"                      -> text(input, "notebook_path");
            // searches without an explicit path cover the workspace and read no particular file
            case "Glob", "Grep", "LS"                -> text(input, "path");
            case "Bash"                              -> text(input, "command");
            default                                  -> null;
        };
        return AgentEvent.toolUse(tool, op, target);
    }

    private static String text(JsonNode input, String field) {
        JsonNode value = input.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
