package com.agentflow.runner.executor.diff;

import java.util.List;

/**
 * One {@code @@ -oldStart,oldCount +newStart,newCount @@} block.
 *
 * @param lines body lines, each starting with ' ', '-' or '+'
 * @param newEndsWithoutNewline the hunk's last new-side line carries "\ No newline at end of file"
 */
public record Hunk(int oldStart, int oldCount, int newStart, int newCount,
                   List<String> lines, boolean newEndsWithoutNewline) {

    public Hunk {
        lines = List.copyOf(lines);
    }

    /** Lines the file must contain where the hunk applies (context and removals). */
    public List<String> oldSide() {
        return lines.stream().filter(l -> l.charAt(0) != '+').map(l -> l.substring(1)).toList();
    }

    /** Lines that replace {@link #oldSide()} (context and additions). */
    public List<String> newSide() {
        return lines.stream().filter(l -> l.charAt(0) != '-').map(l -> l.substring(1)).toList();
    }

    public int added()   { return (int) lines.stream().filter(l -> l.charAt(0) == '+').count(); }
    public int removed() { return (int) lines.stream().filter(l -> l.charAt(0) == '-').count(); }
}
