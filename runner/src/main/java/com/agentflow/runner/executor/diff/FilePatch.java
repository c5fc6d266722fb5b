package com.agentflow.runner.executor.diff;

import java.util.List;

/**
 * Changes to one file.
 *
 * @param oldPath workspace-relative path before the change; null for a new file
 * @param newPath workspace-relative path after the change; null for a deletion
 */
public record FilePatch(String oldPath, String newPath, List<Hunk> hunks) {

    public FilePatch {
        hunks = List.copyOf(hunks);
    }

    public boolean isCreation() { return oldPath == null; }
    public boolean isDeletion() { return newPath == null; }
    public boolean isRename()   { return oldPath != null && newPath != null && !oldPath.equals(newPath); }

    /** The path this patch leaves behind, or the deleted one. */
    public String path() {
        return newPath != null ? newPath : oldPath;
    }

    public int added()   { return hunks.stream().mapToInt(Hunk::added).sum(); }
    public int removed() { return hunks.stream().mapToInt(Hunk::removed).sum(); }
}
