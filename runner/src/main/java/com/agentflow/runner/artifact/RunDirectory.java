package com.agentflow.runner.artifact;

import com.agentflow.runner.model.RunState;
import com.agentflow.runner.redact.Redactor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Handle on one run's directory: {@code <artifactsDir>/<runId>/}.
 *
 * Layout:
 * <pre>
 *   run-state.json                 canonical RunState, replaced after every step
 *   &lt;stepId&gt;/policy.json           } immutable per-step artifacts
 *   &lt;stepId&gt;/transcript.md         }
 *   &lt;stepId&gt;/output.txt            }
 *   &lt;stepId&gt;/metrics.json          }
 *   &lt;stepId&gt;/backup/               apply_diff snapshots
 *   _attempts/&lt;stepId&gt;/&lt;n&gt;/        step directories superseded by a resume
 * </pre>
 *
 * Every artifact write goes through the {@link Redactor} and lands via
 * a temp file plus atomic move, so a crash never leaves a half-written file.
 */
public class RunDirectory {

    private static final Logger log = LoggerFactory.getLogger(RunDirectory.class);

    public static final String RUN_STATE_FILE = "run-state.json";
    public static final String ATTEMPTS_DIR   = "_attempts";

    private final String       runId;
    private final Path         root;
    private final ObjectMapper json;
    private final Redactor     redactor;

    RunDirectory(String runId, Path root, ObjectMapper json, Redactor redactor) {
        this.runId    = runId;
        this.root     = root.toAbsolutePath().normalize();
        this.json     = json;
        this.redactor = redactor;
    }

    public String runId() { return runId; }
    public Path   root()  { return root; }

    public boolean exists() {
        return Files.isRegularFile(root.resolve(RUN_STATE_FILE));
    }

    // ------------------------------------------------------------------
    // Run state
    // ------------------------------------------------------------------

    /**
     * Atomically replace {@code run-state.json}.
     *
     * Only step error messages are redacted. The workflow snapshot is what a
     * resume replays, so it is stored exactly as declared.
     */
    public void saveRunState(RunState state) {
        ensureDir(root);
        String body;
        try {
            ObjectNode tree = json.valueToTree(state);
            for (JsonNode result : tree.path("stepResults")) {
                JsonNode message = result.get("errorMessage");
                if (message != null && message.isTextual()) {
                    ((ObjectNode) result).put("errorMessage", redactor.redact(message.asText()));
                }
            }
            body = json.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ArtifactWriteException("Could not serialize run state for " + runId, e);
        }
        writeAtomically(root.resolve(RUN_STATE_FILE), body, true);
    }

    public Optional<RunState> loadRunState() {
        Path file = root.resolve(RUN_STATE_FILE);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(json.readValue(Files.readString(file, StandardCharsets.UTF_8), RunState.class));
        } catch (IOException e) {
            throw new ArtifactReadException("Could not read run state " + file, e);
        }
    }

    // ------------------------------------------------------------------
    // Step artifacts
    // ------------------------------------------------------------------

    public Path stepDir(String stepId) {
        return root.resolve(stepId);
    }

    /** Relative reference stored in StepResult.outputRef, e.g. {@code build/output.txt}. */
    public String ref(String stepId, ArtifactType type) {
        return stepId + "/" + type.fileName();
    }

    /**
     * Write a text artifact once.
     *
     * @throws ArtifactWriteException if it already exists or the write fails
     */
    public String writeText(String stepId, ArtifactType type, String content) {
        Path dir = ensureDir(stepDir(stepId));
        writeAtomically(dir.resolve(type.fileName()), redactor.redact(content), false);
        return ref(stepId, type);
    }

    /** Serialize {@code value} as pretty JSON and write it once. */
    public String writeJson(String stepId, ArtifactType type, Object value) {
        String body;
        try {
            body = json.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new ArtifactWriteException("Could not serialize " + type.fileName() + " for step " + stepId, e);
        }
        return writeText(stepId, type, body);
    }

    public TranscriptWriter openTranscript(String stepId) {
        Path target = ensureDir(stepDir(stepId)).resolve(ArtifactType.TRANSCRIPT.fileName());
        if (Files.exists(target)) {
            throw new ArtifactWriteException("Artifact already written: " + target);
        }
        return new TranscriptWriter(target, redactor);
    }

    public Optional<String> readText(String stepId, ArtifactType type) {
        Path file = stepDir(stepId).resolve(type.fileName());
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactReadException("Could not read " + file, e);
        }
    }

    /** Directory apply_diff steps copy originals into before mutating the workspace. */
    public Path backupDir(String stepId) {
        return ensureDir(stepDir(stepId).resolve("backup"));
    }

    /**
     * Move a step's artifacts out of the way before the step is re-executed,
     * so earlier artifacts are kept rather than overwritten.
     *
     * @return where the artifacts went, or empty if the step had none
     */
    public Optional<Path> archiveStep(String stepId) {
        Path dir = stepDir(stepId);
        if (!Files.isDirectory(dir)) return Optional.empty();
        Path attempts = ensureDir(root.resolve(ATTEMPTS_DIR).resolve(stepId));
        int next;
        try (Stream<Path> existing = Files.list(attempts)) {
            next = (int) existing.count() + 1;
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not list " + attempts, e);
        }
        Path target = attempts.resolve(String.valueOf(next));
        try {
            Files.move(dir, target);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not archive artifacts of step " + stepId, e);
        }
        log.info("Archived artifacts of step {} to {}", stepId, root.relativize(target));
        return Optional.of(target);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Path ensureDir(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not create directory " + dir, e);
        }
    }

    private static void writeAtomically(Path target, String content, boolean replace) {
        if (!replace && Files.exists(target)) {
            throw new ArtifactWriteException("Artifact already written: " + target);
        }
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ArtifactWriteException("Could not write " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
