package com.agentflow.runner.executor.diff;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatchApplierTest {

    private static FilePatch single(String diff) {
        return UnifiedDiffParser.parse(diff).get(0);
    }

    @Test
    void apply_modification_replacesLines() {
        FilePatch patch = single("""
                --- a/f.txt
                +++ b/f.txt
                @@ -2,2 +2,2 @@
                 two
                -three
                +THREE
                """);

        assertThat(PatchApplier.apply("one\ntwo\nthree\nfour\n", patch)).isEqualTo("one\ntwo\nTHREE\nfour\n");
    }

    @Test
    void apply_hunkLineNumbersOff_matchesNearbyOffset() {
        FilePatch patch = single("""
                --- a/f.txt
                +++ b/f.txt
                @@ -1,2 +1,2 @@
                 gamma
                -delta
                +DELTA
                """);

        assertThat(PatchApplier.apply("alpha\nbeta\ngamma\ndelta\n", patch))
                .isEqualTo("alpha\nbeta\ngamma\nDELTA\n");
    }

    @Test
    void apply_contextMismatch_rejected() {
        FilePatch patch = single("""
                --- a/f.txt
                +++ b/f.txt
                @@ -1,2 +1,2 @@
                 one
                -two
                +2
                """);

        assertThatThrownBy(() -> PatchApplier.apply("one\nthree\n", patch))
                .isInstanceOf(PatchException.class)
                .hasMessageContaining("does not match f.txt");
    }

    @Test
    void apply_creation_fromNothing() {
        FilePatch patch = single("""
                --- /dev/null
                +++ b/new.txt
                @@ -0,0 +1,2 @@
                +hello
                +world
                """);

        assertThat(PatchApplier.apply(null, patch)).isEqualTo("hello\nworld\n");
        assertThatThrownBy(() -> PatchApplier.apply("exists\n", patch))
                .hasMessage("new.txt already exists");
    }

    @Test
    void apply_deletion_returnsNull() {
        FilePatch patch = single("""
                --- a/old.txt
                +++ /dev/null
                @@ -1,2 +0,0 @@
                -a
                -b
                """);

        assertThat(PatchApplier.apply("a\nb\n", patch)).isNull();
        assertThatThrownBy(() -> PatchApplier.apply(null, patch)).hasMessage("old.txt does not exist");
    }

    @Test
    void apply_noNewlineAtEnd_preserved() {
        FilePatch patch = single("""
                --- a/f.txt
                +++ b/f.txt
                @@ -1 +1 @@
                -old
                \\ No newline at end of file
                +new
                \\ No newline at end of file
                """);

        assertThat(PatchApplier.apply("old", patch)).isEqualTo("new");
    }

    @Test
    void apply_multipleHunks_appliedInOrder() {
        FilePatch patch = single("""
                --- a/f.txt
                +++ b/f.txt
                @@ -1,2 +1,2 @@
                -1
                +one
                 2
                @@ -5,2 +5,2 @@
                 5
                -6
                +six
                """);

        assertThat(PatchApplier.apply("1\n2\n3\n4\n5\n6\n", patch)).isEqualTo("one\n2\n3\n4\n5\nsix\n");
    }
}
