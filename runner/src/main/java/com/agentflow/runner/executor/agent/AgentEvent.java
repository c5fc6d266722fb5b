package com.agentflow.runner.executor.agent;

import com.agentflow.runner.policy.Operation;

/**
 * One event of interest from the agent's stream-json output.
 *
 * @param tool      tool name for TOOL_USE events
 * @param operation what the tool does to the workspace; null for tools the policy does not cover
 * @param target    path or command line the tool acts on; null when the tool names none
 * @param text      assistant text or final result text
 */
public record AgentEvent(Kind kind, String tool, Operation operation, String target, String text) {

    public enum Kind { TOOL_USE, TEXT, RESULT }

    static AgentEvent toolUse(String tool, Operation operation, String target) {
        return new AgentEvent(Kind.TOOL_USE, tool, operation, target, null);
    }

    static AgentEvent text(String text) {
        return new AgentEvent(Kind.TEXT, null, null, null, text);
    }

    static AgentEvent result(String text) {
        return new AgentEvent(Kind.RESULT, null, null, null, text);
    }

    /** True when the enforcer has to decide this event before the agent may proceed. */
    public boolean needsPolicyCheck() {
        return kind == Kind.TOOL_USE && operation != null && target != null;
    }
}
