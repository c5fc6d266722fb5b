package com.agentflow.runner.executor.agent;

import com.agentflow.runner.executor.RunContext;

import java.time.Duration;
import java.util.List;

/**
 * One agent invocation.
 *
 * @param allowedTools passed as {@code --allowedTools}; empty leaves the agent's defaults
 */
public record AgentRequest(
        String       stepId,
        String       prompt,
        List<String> allowedTools,
        Duration     timeout,
        RunContext   context) {

    public AgentRequest {
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
    }
}
