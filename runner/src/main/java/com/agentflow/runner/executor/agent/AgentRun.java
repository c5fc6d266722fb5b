package com.agentflow.runner.executor.agent;

import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.process.ProcessOutcome;

import java.util.List;

/**
 * What came out of one agent invocation.
 *
 * @param resultText final {@code result} event text, or null if the agent never sent one
 * @param denial     the first denied operation; the agent was terminated because of it
 * @param tail       last lines of the merged output, for output.txt when there is no result
 */
public record AgentRun(
        ProcessOutcome outcome,
        String         resultText,
        PolicyDecision denial,
        List<String>   tail) {

    public boolean denied() { return denial != null; }

    /** Final result text, or the output tail when the agent did not produce one. */
    public String output() {
        return resultText != null ? resultText : String.join("\n", tail);
    }
}
