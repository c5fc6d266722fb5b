package com.agentflow.runner.executor.impl;

import com.agentflow.runner.artifact.ArtifactType;
import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutionException;
import com.agentflow.runner.executor.StepExecutor;
import com.agentflow.runner.executor.StepMetrics;
import com.agentflow.runner.executor.agent.AgentEvent;
import com.agentflow.runner.executor.agent.AgentEventParser;
import com.agentflow.runner.executor.diff.DiffExtractor;
import com.agentflow.runner.executor.diff.FilePatch;
import com.agentflow.runner.executor.diff.PatchApplier;
import com.agentflow.runner.executor.diff.PatchException;
import com.agentflow.runner.executor.diff.UnifiedDiffParser;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepType;
import com.agentflow.runner.policy.PolicyDecision;
import com.agentflow.runner.policy.PolicyEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@code apply_diff} steps: apply the unified diff an earlier agent step
 * produced to the workspace.
 *
 * <ol>
 *   <li>Refuse unless the step says {@code approve: true} or the run was
 *       started with {@code --approve-all}.</li>
 *   <li>Take the diff from the source step's output.txt, falling back to
 *       the text events in its transcript.</li>
 *   <li>Check every touched path against the source step's policy.</li>
 *   <li>Compute all new file contents in memory, copy every touched file
 *       to {@code <stepId>/backup/}, then write.</li>
 *   <li>If any write fails, restore every touched file from the backup; the
 *       failure message names any file that could not be restored.</li>
 * </ol>
 */
@Component
public class ApplyDiffStepExecutor implements StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(ApplyDiffStepExecutor.class);

    private final Clock clock;

    public ApplyDiffStepExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override public StepType type() { return StepType.APPLY_DIFF; }

    @Override
    public StepResult execute(StepDefinition step, RunContext ctx) {
        Instant start = clock.instant();
        RunDirectory dir = ctx.runDirectory();

        if (!Boolean.TRUE.equals(step.approve()) && !ctx.approveAll()) {
            String message = "Step '" + step.id() + "' needs approval before the diff is applied: "
                    + "set 'approve: true' on the step or rerun with --approve-all";
            String ref = dir.writeText(step.id(), ArtifactType.OUTPUT, message + "\n");
            return StepResult.failed(step.id(), FailureKind.APPROVAL_REQUIRED, null, start, clock.instant(),
                    ref, message);
        }

        StepDefinition source = sourceStep(step, ctx);
        Optional<String> diff = findDiff(source.id(), dir);
        if (diff.isEmpty()) {
            return fail(step, dir, start, FailureKind.EXECUTOR_ERROR,
                    "No unified diff found in the output of step '" + source.id() + "'", null);
        }

        List<FilePatch> patches;
        try {
            patches = UnifiedDiffParser.parse(diff.get());
        } catch (PatchException e) {
            return fail(step, dir, start, FailureKind.EXECUTOR_ERROR,
                    "Diff from step '" + source.id() + "' is malformed: " + e.getMessage(), null);
        }

        PolicyEnforcer enforcer = new PolicyEnforcer(source.policy(), ctx.workspaceRoot());
        for (String path : touchedPaths(patches)) {
            PolicyDecision decision = enforcer.checkEdit(path);
            if (!decision.allowed()) {
                return fail(step, dir, start, FailureKind.POLICY_VIOLATION,
                        "Diff touches a path outside the policy of step '" + source.id() + "': "
                                + decision.reason(), enforcer);
            }
        }

        Path root = ctx.workspaceRoot();
        Map<String, String> newContents;
        try {
            newContents = computeContents(patches, root);
        } catch (PatchException e) {
            return fail(step, dir, start, FailureKind.EXECUTOR_ERROR,
                    "Diff does not apply: " + e.getMessage(), enforcer);
        }

        Path backup = dir.backupDir(step.id());
        Set<String> existed = snapshot(newContents.keySet(), root, backup);
        try {
            write(newContents, root);
        } catch (IOException e) {
            List<String> unrestored = restore(newContents.keySet(), existed, root, backup);
            return fail(step, dir, start, FailureKind.EXECUTOR_ERROR,
                    writeFailureMessage(e.getMessage(), unrestored, backup), enforcer);
        }

        StringBuilder summary = new StringBuilder("Applied diff from step '")
                .append(source.id()).append("' to ").append(patches.size()).append(" file(s):\n");
        for (FilePatch p : patches) {
            String mode = p.isCreation() ? "A" : p.isDeletion() ? "D" : p.isRename() ? "R" : "M";
            summary.append("  ").append(mode).append(' ').append(p.path())
                   .append(" (+").append(p.added()).append(" -").append(p.removed()).append(")\n");
        }
        String ref = dir.writeText(step.id(), ArtifactType.OUTPUT, summary.toString());
        writeMetrics(step, dir, start, enforcer);
        log.info("Applied {} file patch(es) from step {}", patches.size(), source.id());
        return StepResult.completed(step.id(), null, start, clock.instant(), ref);
    }

    // ------------------------------------------------------------------
    // Diff source
    // ------------------------------------------------------------------

    /** The declared source_step, or the nearest preceding agent step. */
    StepDefinition sourceStep(StepDefinition step, RunContext ctx) {
        List<StepDefinition> steps = ctx.workflow().steps();
        if (step.sourceStep() != null) {
            return ctx.workflow().step(step.sourceStep()).orElseThrow(() -> new StepExecutionException(
                    "source_step '" + step.sourceStep() + "' of step '" + step.id() + "' does not exist"));
        }
        for (int i = ctx.workflow().indexOf(step.id()) - 1; i >= 0; i--) {
            if (steps.get(i).type() == StepType.AGENT) return steps.get(i);
        }
        throw new StepExecutionException("Step '" + step.id() + "' has no preceding agent step to take a diff from");
    }

    private static Optional<String> findDiff(String sourceId, RunDirectory dir) {
        Optional<String> fromOutput = dir.readText(sourceId, ArtifactType.OUTPUT).flatMap(DiffExtractor::extract);
        if (fromOutput.isPresent()) return fromOutput;

        return dir.readText(sourceId, ArtifactType.TRANSCRIPT).flatMap(transcript -> {
            StringBuilder text = new StringBuilder();
            for (String line : transcript.split("\n")) {
                for (AgentEvent event : AgentEventParser.parse(line)) {
                    if (event.text() != null) text.append(event.text()).append('\n');
                }
            }
            return DiffExtractor.extract(text.toString());
        });
    }

    private static Set<String> touchedPaths(List<FilePatch> patches) {
        Set<String> paths = new LinkedHashSet<>();
        for (FilePatch p : patches) {
            if (p.oldPath() != null) paths.add(p.oldPath());
            if (p.newPath() != null) paths.add(p.newPath());
        }
        return paths;
    }

    // ------------------------------------------------------------------
    // Apply with backup
    // ------------------------------------------------------------------

    /** Path → new content (null for deletions) for every touched file. */
    private static Map<String, String> computeContents(List<FilePatch> patches, Path root) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (FilePatch p : patches) {
            String key = p.isCreation() ? p.newPath() : p.oldPath();
            // a file patched twice in one diff sees the first patch's result
            String current = contents.containsKey(key) ? contents.get(key) : read(root, key);
            String updated = PatchApplier.apply(current, p);
            if (p.isRename()) {
                contents.put(p.oldPath(), null);
            }
            contents.put(p.path(), updated);
        }
        return contents;
    }

    private static String read(Path root, String rel) {
        Path file = root.resolve(rel);
        if (!Files.isRegularFile(file)) return null;
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PatchException("Cannot read " + rel + ": " + e.getMessage());
        }
    }

    /** Copy every existing touched file into {@code backup}; returns the ones that existed. */
    private static Set<String> snapshot(Set<String> paths, Path root, Path backup) {
        Set<String> existed = new LinkedHashSet<>();
        for (String rel : paths) {
            Path file = root.resolve(rel);
            if (!Files.isRegularFile(file)) continue;
            Path copy = backup.resolve(rel);
            try {
                Files.createDirectories(copy.getParent());
                Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (IOException e) {
                throw new StepExecutionException("Could not back up " + rel + " before applying the diff", e);
            }
            existed.add(rel);
        }
        return existed;
    }

    private static void write(Map<String, String> contents, Path root) throws IOException {
        for (Map.Entry<String, String> entry : contents.entrySet()) {
            Path file = root.resolve(entry.getKey());
            if (entry.getValue() == null) {
                Files.deleteIfExists(file);
            } else {
                if (file.getParent() != null) Files.createDirectories(file.getParent());
                Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8);
            }
        }
    }

    /** Undo a partial write; returns the paths that could not be put back. */
    static List<String> restore(Set<String> paths, Set<String> existed, Path root, Path backup) {
        List<String> unrestored = new ArrayList<>();
        for (String rel : paths) {
            Path file = root.resolve(rel);
            try {
                if (existed.contains(rel)) {
                    Files.copy(backup.resolve(rel), file, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.deleteIfExists(file);
                }
            } catch (IOException e) {
                log.error("Could not restore {} from {}: {}", rel, backup, e.getMessage());
                unrestored.add(rel);
            }
        }
        return unrestored;
    }

    static String writeFailureMessage(String cause, List<String> unrestored, Path backup) {
        if (unrestored.isEmpty()) {
            return "Writing the patched files failed, workspace restored: " + cause;
        }
        return "Writing the patched files failed: " + cause + "; could not restore "
                + String.join(", ", unrestored) + " (originals are in " + backup + ")";
    }

    // ------------------------------------------------------------------
    // Results
    // ------------------------------------------------------------------

    private StepResult fail(StepDefinition step, RunDirectory dir, Instant start, FailureKind kind,
                            String message, PolicyEnforcer enforcer) {
        log.warn("apply_diff step {} failed: {}", step.id(), message);
        String ref = dir.writeText(step.id(), ArtifactType.OUTPUT, message + "\n");
        if (enforcer != null) writeMetrics(step, dir, start, enforcer);
        return StepResult.failed(step.id(), kind, null, start, clock.instant(), ref, message);
    }

    private void writeMetrics(StepDefinition step, RunDirectory dir, Instant start, PolicyEnforcer enforcer) {
        dir.writeJson(step.id(), ArtifactType.METRICS, StepMetrics.of(step.id(), type().yamlName(),
                Duration.between(start, clock.instant()), null, false, enforcer));
    }
}
