package com.agentflow.runner.policy;

import com.agentflow.runner.model.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates file and command operations against one step's {@link Policy}.
 *
 * One instance per step execution: it keeps the running counters (distinct
 * files read, edits made) and denies further operations of a kind once the
 * corresponding quota is used up. Every decision is kept so executors can
 * write it to {@code metrics.json}.
 *
 * <p>This is an in-process soft limit. It only sees the operations an
 * executor asks about; it cannot intercept anything else.
 *
 * <p>Methods are synchronized because the agent executor consults the
 * enforcer from its output-reader thread while the runner thread reads
 * the counters.
 */
public class PolicyEnforcer {

    private static final Logger log = LoggerFactory.getLogger(PolicyEnforcer.class);

    private final Policy            policy;
    private final Path              workspaceRoot;
    private final List<PathMatcher> matchers = new ArrayList<>();

    private final Set<String>          filesRead   = new LinkedHashSet<>();
    private final List<String>         filesEdited = new ArrayList<>();
    private final List<String>         commandsRun = new ArrayList<>();
    private final List<PolicyDecision> decisions   = new ArrayList<>();

    public PolicyEnforcer(Policy policy, Path workspaceRoot) {
        this.policy        = policy;
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        for (String glob : policy.allowedPaths()) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            // "**/x" should also match "x" at the workspace root
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
    }

    public Policy policy() { return policy; }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    /** Decide a file read. Re-reading an already counted file does not consume quota. */
    public synchronized PolicyDecision checkRead(String path) {
        PolicyDecision pathDecision = checkPath(Operation.READ, path);
        if (!pathDecision.allowed()) return record(pathDecision);

        String key = relative(path).toString();
        if (!filesRead.contains(key) && filesRead.size() >= policy.maxFiles()) {
            return record(PolicyDecision.deny(Operation.READ, path,
                    "file quota exhausted (max_files=" + policy.maxFiles() + ")"));
        }
        filesRead.add(key);
        return record(pathDecision);
    }

    /** Decide a file edit. Every allowed edit consumes one unit of max_edits. */
    public synchronized PolicyDecision checkEdit(String path) {
        PolicyDecision pathDecision = checkPath(Operation.EDIT, path);
        if (!pathDecision.allowed()) return record(pathDecision);

        if (filesEdited.size() >= policy.maxEdits()) {
            return record(PolicyDecision.deny(Operation.EDIT, path,
                    "edit quota exhausted (max_edits=" + policy.maxEdits() + ")"));
        }
        filesEdited.add(relative(path).toString());
        return record(pathDecision);
    }

    /**
     * Decide a command line. Every executable in a chained line must be on
     * the allowlist by exact name; an empty allowlist denies everything.
     */
    public synchronized PolicyDecision checkCommand(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return record(PolicyDecision.deny(Operation.COMMAND, String.valueOf(commandLine), "empty command"));
        }
        if (policy.commandAllowlist().isEmpty()) {
            return record(PolicyDecision.deny(Operation.COMMAND, commandLine, "command allowlist is empty"));
        }
        if (CommandLines.hasSubstitution(commandLine)) {
            return record(PolicyDecision.deny(Operation.COMMAND, commandLine,
                    "command substitution is not allowed"));
        }
        List<String> executables = CommandLines.executables(commandLine);
        if (executables.isEmpty()) {
            return record(PolicyDecision.deny(Operation.COMMAND, commandLine, "no executable found"));
        }
        for (String exe : executables) {
            if (!policy.commandAllowlist().contains(exe)) {
                return record(PolicyDecision.deny(Operation.COMMAND, commandLine,
                        "'" + exe + "' is not in cmd_allowlist " + policy.commandAllowlist()));
            }
        }
        commandsRun.add(commandLine);
        return record(PolicyDecision.allow(Operation.COMMAND, commandLine));
    }

    // ------------------------------------------------------------------
    // Counters
    // ------------------------------------------------------------------

    public synchronized int filesReadCount()  { return filesRead.size(); }
    public synchronized int editsMadeCount()  { return filesEdited.size(); }
    public synchronized int commandsRunCount() { return commandsRun.size(); }

    public synchronized List<String> filesRead()   { return List.copyOf(filesRead); }
    public synchronized List<String> filesEdited() { return List.copyOf(filesEdited); }
    public synchronized List<String> commandsRun() { return List.copyOf(commandsRun); }

    public synchronized List<PolicyDecision> decisions() { return List.copyOf(decisions); }

    public synchronized List<PolicyDecision> denials() {
        return decisions.stream().filter(d -> !d.allowed()).toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PolicyDecision checkPath(Operation op, String path) {
        if (path == null || path.isBlank()) {
            return PolicyDecision.deny(op, String.valueOf(path), "empty path");
        }
        Path rel;
        try {
            rel = relative(path);
        } catch (InvalidPathException e) {
            return PolicyDecision.deny(op, path, "invalid path");
        }
        if (rel == null || rel.startsWith("..") || rel.isAbsolute()) {
            return PolicyDecision.deny(op, path, "path is outside the workspace");
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(rel)) {
                return PolicyDecision.allow(op, path);
            }
        }
        return PolicyDecision.deny(op, path, "path does not match allowed_paths " + policy.allowedPaths());
    }

    /** Workspace-relative, normalised form of {@code path}; absolute paths outside the root stay absolute. */
    private Path relative(String path) {
        Path p = Path.of(path);
        if (p.isAbsolute()) {
            Path normalized = p.normalize();
            return normalized.startsWith(workspaceRoot) ? workspaceRoot.relativize(normalized) : normalized;
        }
        return p.normalize();
    }

    private PolicyDecision record(PolicyDecision decision) {
        decisions.add(decision);
        if (!decision.allowed()) {
            // target may carry credential-shaped text and logs bypass the redactor
            log.warn("Policy denied {}: {}", decision.operation(), decision.reason());
        }
        return decision;
    }
}
