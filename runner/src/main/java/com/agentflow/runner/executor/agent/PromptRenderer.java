package com.agentflow.runner.executor.agent;

import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutionException;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.policy.PolicyEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Builds the prompt text sent to the agent on stdin.
 *
 * The prompt file is resolved against the workflow file's directory. For
 * prompt steps, files matching {@code inputs.paths} are appended, each read
 * going through the step's enforcer and limited by
 * {@code inputs.file_size_limit_kb}.
 */
@Component
public class PromptRenderer {

    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    public static final int DEFAULT_FILE_SIZE_LIMIT_KB = 100;

    /** Text of the step's prompt file, or a generic instruction when it has none. */
    public String promptText(StepDefinition step, RunContext ctx) {
        if (step.promptFile() == null) {
            return "Carry out step '" + step.id() + "' of workflow '" + ctx.workflow().name() + "'.";
        }
        Path file = ctx.workflowDir().resolve(step.promptFile()).normalize();
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StepExecutionException("Could not read prompt file " + file + ": " + e.getMessage(), e);
        }
    }

    /** Prompt text followed by the step's input files. */
    public String render(StepDefinition step, RunContext ctx, PolicyEnforcer enforcer) {
        StringBuilder sb = new StringBuilder(promptText(step, ctx));
        List<String> globs = inputPaths(step);
        if (globs.isEmpty()) return sb.toString();

        long limitBytes = fileSizeLimitKb(step) * 1024L;
        List<String> skipped = new ArrayList<>();
        sb.append("\n\n## Input files\n");
        for (Path rel : matchingFiles(ctx.workspaceRoot(), globs)) {
            Path abs = ctx.workspaceRoot().resolve(rel);
            try {
                if (Files.size(abs) > limitBytes) {
                    skipped.add(rel + " (larger than " + fileSizeLimitKb(step) + " KB)");
                    continue;
                }
                PolicyDecision decision = enforcer.checkRead(rel.toString());
                if (!decision.allowed()) {
                    skipped.add(rel + " (" + decision.reason() + ")");
                    continue;
                }
                sb.append("\n### ").append(rel).append("\n```\n")
                  .append(Files.readString(abs, StandardCharsets.UTF_8))
                  .append("\n```\n");
            } catch (MalformedInputException e) {
                skipped.add(rel + " (not UTF-8 text)");
            } catch (IOException e) {
                throw new StepExecutionException("Could not read input file " + abs + ": " + e.getMessage(), e);
            }
        }
        if (!skipped.isEmpty()) {
            log.info("Step {} skipped {} input file(s)", step.id(), skipped.size());
            sb.append("\n## Skipped input files\n");
            skipped.forEach(s -> sb.append("- ").append(s).append('\n'));
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    public static List<String> inputPaths(StepDefinition step) {
        Object paths = step.inputsOrEmpty().get("paths");
        return paths instanceof List
                ? ((List<?>) paths).stream().map(String::valueOf).toList()
                : List.of();
    }

    static int fileSizeLimitKb(StepDefinition step) {
        Object limit = step.inputsOrEmpty().get("file_size_limit_kb");
        return limit instanceof Number ? ((Number) limit).intValue() : DEFAULT_FILE_SIZE_LIMIT_KB;
    }

    /** Workspace-relative regular files matching any glob, sorted, hidden directories skipped. */
    static List<Path> matchingFiles(Path root, List<String> globs) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(rel -> !isHidden(rel))
                    .filter(rel -> matchers.stream().anyMatch(m -> m.matches(rel)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StepExecutionException("Could not list workspace " + root + ": " + e.getMessage(), e);
        }
    }

    private static boolean isHidden(Path rel) {
        for (Path part : rel) {
            if (part.toString().startsWith(".")) return true;
        }
        return false;
    }
}
