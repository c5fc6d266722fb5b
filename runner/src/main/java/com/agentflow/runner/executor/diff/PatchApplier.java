package com.agentflow.runner.executor.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies one {@link FilePatch} to file content in memory.
 *
 * Each hunk must match the file exactly (context and removed lines). It is
 * tried at its declared position first, then at the nearest offset after
 * the previous hunk; a hunk that matches nowhere fails the whole patch.
 */
public class PatchApplier {

    private PatchApplier() {}

    /**
     * @param original current content, or null if the file does not exist
     * @return new content, or null if the patch deletes the file
     * @throws PatchException if a hunk does not match
     */
    public static String apply(String original, FilePatch patch) {
        if (patch.isCreation() && original != null && !original.isEmpty()) {
            throw new PatchException(patch.path() + " already exists");
        }
        if (!patch.isCreation() && original == null) {
            throw new PatchException(patch.oldPath() + " does not exist");
        }

        String text = original == null ? "" : original;
        boolean endsWithNewline = text.isEmpty() || text.endsWith("\n");
        List<String> lines = splitLines(text);

        List<String> result = new ArrayList<>();
        int cursor = 0;
        for (Hunk hunk : patch.hunks()) {
            List<String> oldSide = hunk.oldSide();
            int at = locate(lines, oldSide, Math.max(hunk.oldStart() - 1, 0), cursor);
            if (at < 0) {
                throw new PatchException("Hunk @@ -" + hunk.oldStart() + "," + hunk.oldCount()
                        + " does not match " + patch.path());
            }
            result.addAll(lines.subList(cursor, at));
            result.addAll(hunk.newSide());
            cursor = at + oldSide.size();
            if (cursor == lines.size()) {
                endsWithNewline = !hunk.newEndsWithoutNewline();
            }
        }
        result.addAll(lines.subList(cursor, lines.size()));

        if (patch.isDeletion()) {
            if (!result.isEmpty()) {
                throw new PatchException("Deletion of " + patch.oldPath() + " leaves content behind");
            }
            return null;
        }
        if (result.isEmpty()) return "";
        return String.join("\n", result) + (endsWithNewline ? "\n" : "");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static List<String> splitLines(String text) {
        if (text.isEmpty()) return List.of();
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return List.of(body.split("\n", -1));
    }

    /** First index >= floor where {@code expected} matches, preferring positions closest to {@code preferred}. */
    private static int locate(List<String> lines, List<String> expected, int preferred, int floor) {
        int max = lines.size() - expected.size();
        if (max < floor) return -1;
        int start = Math.min(Math.max(preferred, floor), max);
        for (int offset = 0; start - offset >= floor || start + offset <= max; offset++) {
            if (start + offset <= max && matchesAt(lines, expected, start + offset)) return start + offset;
            if (offset > 0 && start - offset >= floor && matchesAt(lines, expected, start - offset)) {
                return start - offset;
            }
        }
        return -1;
    }

    private static boolean matchesAt(List<String> lines, List<String> expected, int at) {
        for (int k = 0; k < expected.size(); k++) {
            if (!lines.get(at + k).equals(expected.get(k))) return false;
        }
        return true;
    }
}
