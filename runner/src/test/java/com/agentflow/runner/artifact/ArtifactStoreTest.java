package com.agentflow.runner.artifact;

import com.agentflow.runner.TestFixtures;
import com.agentflow.runner.config.ObjectMappers;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.RunState;
import com.agentflow.runner.model.RunStatus;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.redact.Redactor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.agentflow.runner.TestFixtures.cmd;
import static com.agentflow.runner.TestFixtures.read;
import static com.agentflow.runner.TestFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ArtifactStore, RunDirectory and TranscriptWriter against
 * a temp directory.
 */
class ArtifactStoreTest {

    @TempDir Path tmp;

    // ------------------------------------------------------------------
    // Directory resolution
    // ------------------------------------------------------------------

    @Test
    void create_noTemplateNoOverride_usesDefaultRoot() {
        ArtifactStore store = TestFixtures.artifactStore(tmp.resolve("runs"));

        RunDirectory dir = store.create("run-1", null, null);

        assertThat(dir.root()).isEqualTo(tmp.resolve("runs/run-1").toAbsolutePath());
    }

    @Test
    void create_templateWithRunId_isTheRunDirectory() {
        ArtifactStore store = TestFixtures.artifactStore(tmp.resolve("runs"));

        RunDirectory dir = store.create("run-1", tmp + "/custom/${RUN_ID}", null);

        assertThat(dir.root()).isEqualTo(tmp.resolve("custom/run-1").toAbsolutePath());
        assertThat(store.open("run-1", tmp.resolve("custom")).root()).isEqualTo(dir.root());
    }

    @Test
    void create_templateWithoutRunId_getsRunIdAppended() {
        ArtifactStore store = new ArtifactStore(tmp.resolve("runs"), ObjectMappers.json(),
                new Redactor(), name -> "BASE".equals(name) ? tmp.toString() : null);

        RunDirectory dir = store.create("run-1", "${BASE}/elsewhere", null);

        assertThat(dir.root()).isEqualTo(tmp.resolve("elsewhere/run-1").toAbsolutePath());
    }

    @Test
    void create_overrideWinsOverTemplate() {
        ArtifactStore store = TestFixtures.artifactStore(tmp.resolve("runs"));

        RunDirectory dir = store.create("run-1", tmp + "/custom/${RUN_ID}", tmp.resolve("cli"));

        assertThat(dir.root()).isEqualTo(tmp.resolve("cli/run-1").toAbsolutePath());
    }

    @Test
    void create_doesNotTouchDiskUntilFirstWrite() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).create("run-1", null, null);

        assertThat(Files.exists(dir.root())).isFalse();
        assertThat(dir.exists()).isFalse();
    }

    // ------------------------------------------------------------------
    // Artifacts
    // ------------------------------------------------------------------

    @Test
    void writeText_secondWriteOfSameArtifact_rejected() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);

        String ref = dir.writeText("build", ArtifactType.OUTPUT, "first\n");

        assertThat(ref).isEqualTo("build/output.txt");
        assertThatThrownBy(() -> dir.writeText("build", ArtifactType.OUTPUT, "second\n"))
                .isInstanceOf(ArtifactWriteException.class)
                .hasMessageContaining("already written");
        assertThat(dir.readText("build", ArtifactType.OUTPUT)).contains("first\n");
    }

    @Test
    void writeText_secretsRedactedOnDisk() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);

        dir.writeText("build", ArtifactType.OUTPUT, "key=sk-abcdefghijklmnopqrstuvwxyz\n");

        String onDisk = read(dir.stepDir("build").resolve("output.txt"));
        assertThat(onDisk).doesNotContain("sk-abcdef").contains(Redactor.MASK);
    }

    @Test
    void writeJson_policyUsesSnakeCaseFields() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);

        dir.writeJson("edit", ArtifactType.POLICY, TestFixtures.policy(3, 0, List.of("src/**"), List.of()));

        String body = dir.readText("edit", ArtifactType.POLICY).orElseThrow();
        assertThat(body).contains("\"max_files\"").contains("\"allowed_paths\"").endsWith("\n");
    }

    @Test
    void transcript_chunksRedactedAndFinalizedOnClose() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);

        try (TranscriptWriter t = dir.openTranscript("edit")) {
            t.appendLine("calling API with Bearer abcdefgh12345678");
            assertThat(Files.exists(t.path())).isFalse();
        }

        String transcript = dir.readText("edit", ArtifactType.TRANSCRIPT).orElseThrow();
        assertThat(transcript).isEqualTo("calling API with Bearer " + Redactor.MASK + "\n");
        assertThatThrownBy(() -> dir.openTranscript("edit")).isInstanceOf(ArtifactWriteException.class);
    }

    // ------------------------------------------------------------------
    // Run state and archive
    // ------------------------------------------------------------------

    @Test
    void saveRunState_roundTripsAndReplaces() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);
        Instant now = Instant.parse("2026-01-31T09:15:02Z");
        RunState state = new RunState("run-1", workflow(cmd("build", "make")), tmp.toString(), now);

        dir.saveRunState(state);
        state.getStepResults().add(StepResult.completed("build", 0, now, now, "build/output.txt"));
        state.setStatus(RunStatus.COMPLETED);
        dir.saveRunState(state);

        RunState loaded = dir.loadRunState().orElseThrow();
        assertThat(loaded.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(loaded.getStepResults()).containsExactly(state.getStepResults().get(0));
        assertThat(loaded.getWorkflowSnapshot()).isEqualTo(state.getWorkflowSnapshot());
        assertThat(dir.exists()).isTrue();
    }

    @Test
    void saveRunState_redactsErrorMessagesButKeepsSnapshotVerbatim() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);
        Instant now = Instant.parse("2026-01-31T09:15:02Z");
        RunState state = new RunState("run-1", workflow(cmd("login", "curl -H 'Authorization: Bearer abcdef123456'")),
                tmp.toString(), now);
        state.getStepResults().add(StepResult.failed("login", FailureKind.NON_ZERO_EXIT, 7, now, now,
                "login/output.txt", "curl failed for Bearer abcdef123456"));

        dir.saveRunState(state);

        RunState loaded = dir.loadRunState().orElseThrow();
        assertThat(loaded.getWorkflowSnapshot()).isEqualTo(state.getWorkflowSnapshot());
        assertThat(loaded.getStepResults().get(0).errorMessage())
                .isEqualTo("curl failed for Bearer " + Redactor.MASK);
    }

    @Test
    void archiveStep_movesIntoNumberedAttempts() {
        RunDirectory dir = TestFixtures.artifactStore(tmp).open("run-1", null);
        dir.writeText("build", ArtifactType.OUTPUT, "attempt one\n");

        Path first = dir.archiveStep("build").orElseThrow();
        dir.writeText("build", ArtifactType.OUTPUT, "attempt two\n");
        Path second = dir.archiveStep("build").orElseThrow();

        assertThat(first).isEqualTo(dir.root().resolve("_attempts/build/1"));
        assertThat(second).isEqualTo(dir.root().resolve("_attempts/build/2"));
        assertThat(read(second.resolve("output.txt"))).isEqualTo("attempt two\n");
        assertThat(Files.exists(dir.stepDir("build"))).isFalse();
        assertThat(dir.archiveStep("never-ran")).isEmpty();
    }

    @Test
    void runIds_sortableAndUnique() {
        RunIdGenerator ids = new RunIdGenerator(Clock.fixed(Instant.parse("2026-01-31T09:15:02Z"), ZoneOffset.UTC));

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            String id = ids.next();
            assertThat(id).matches("2026-01-31T09-15-02-[0-9a-z]{6}");
            seen.add(id);
        }
        assertThat(seen).hasSizeGreaterThan(45);
    }
}
