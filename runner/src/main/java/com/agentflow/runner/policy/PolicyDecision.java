package com.agentflow.runner.policy;

/**
 * Allow/deny verdict for one prospective operation.
 *
 * @param target the path or command line exactly as the agent requested it
 * @param reason why the operation was denied; null when allowed
 */
public record PolicyDecision(Operation operation, String target, boolean allowed, String reason) {

    static PolicyDecision allow(Operation op, String target) {
        return new PolicyDecision(op, target, true, null);
    }

    static PolicyDecision deny(Operation op, String target, String reason) {
        return new PolicyDecision(op, target, false, reason);
    }

    public String describe() {
        return allowed
                ? "ALLOWED " + operation + " " + target
                : "DENIED " + operation + " " + target + ": " + reason;
    }
}
