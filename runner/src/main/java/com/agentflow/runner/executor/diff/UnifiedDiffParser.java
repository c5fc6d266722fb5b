package com.agentflow.runner.executor.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses unified diffs as produced by {@code git diff} and {@code diff -u}.
 *
 * Lines outside file sections (prose, {@code index} lines, mode lines) are
 * ignored. Paths lose their {@code a/} and {@code b/} prefixes and any
 * trailing timestamp.
 */
public class UnifiedDiffParser {

    private static final Pattern HUNK_HEADER = Pattern.compile(
            "^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@.*$");

    private static final String DEV_NULL = "/dev/null";

    private UnifiedDiffParser() {}

    /**
     * @throws PatchException if the text contains no file sections or a hunk is malformed
     */
    public static List<FilePatch> parse(String diff) {
        List<String> lines = List.of(diff.replace("\r\n", "\n").split("\n", -1));
        List<FilePatch> patches = new ArrayList<>();

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (!line.startsWith("--- ") || i + 1 >= lines.size() || !lines.get(i + 1).startsWith("+++ ")) {
                i++;
                continue;
            }
            String oldPath = path(line.substring(4));
            String newPath = path(lines.get(i + 1).substring(4));
            i += 2;

            List<Hunk> hunks = new ArrayList<>();
            while (i < lines.size() && lines.get(i).startsWith("@@")) {
                i = parseHunk(lines, i, hunks);
            }
            if (hunks.isEmpty()) {
                throw new PatchException("No hunks for " + (newPath != null ? newPath : oldPath));
            }
            patches.add(new FilePatch(oldPath, newPath, hunks));
        }

        if (patches.isEmpty()) {
            throw new PatchException("No file sections found in diff");
        }
        return patches;
    }

    /** Parse the hunk whose header is at {@code start}; returns the index after it. */
    private static int parseHunk(List<String> lines, int start, List<Hunk> out) {
        Matcher m = HUNK_HEADER.matcher(lines.get(start));
        if (!m.matches()) {
            throw new PatchException("Malformed hunk header: " + lines.get(start));
        }
        int oldStart = Integer.parseInt(m.group(1));
        int oldCount = m.group(2) != null ? Integer.parseInt(m.group(2)) : 1;
        int newStart = Integer.parseInt(m.group(3));
        int newCount = m.group(4) != null ? Integer.parseInt(m.group(4)) : 1;

        List<String> body = new ArrayList<>();
        int oldSeen = 0;
        int newSeen = 0;
        boolean newNoEol = false;
        int i = start + 1;
        while (i < lines.size() && (oldSeen < oldCount || newSeen < newCount)) {
            String line = lines.get(i);
            if (line.startsWith("\\")) {
                i++;
                continue;
            }
            // some tools strip the single space of an empty context line
            if (line.isEmpty()) line = " ";
            switch (line.charAt(0)) {
                case ' ' -> { oldSeen++; newSeen++; }
                case '-' -> oldSeen++;
                case '+' -> newSeen++;
                default  -> throw new PatchException("Unexpected line in hunk at "
                        + lines.get(start) + ": " + line);
            }
            body.add(line);
            i++;
        }
        if (oldSeen != oldCount || newSeen != newCount) {
            throw new PatchException("Truncated hunk " + lines.get(start) + ": expected -" + oldCount
                    + " +" + newCount + ", found -" + oldSeen + " +" + newSeen);
        }
        // "\ No newline at end of file" directly after the hunk refers to its last line
        if (i < lines.size() && lines.get(i).startsWith("\\")) {
            newNoEol = !body.isEmpty() && body.get(body.size() - 1).charAt(0) != '-';
            i++;
        }
        out.add(new Hunk(oldStart, oldCount, newStart, newCount, body, newNoEol));
        return i;
    }

    private static String path(String header) {
        String p = header;
        int tab = p.indexOf('\t');
        if (tab >= 0) p = p.substring(0, tab);
        p = p.strip();
        if (p.equals(DEV_NULL)) return null;
        if (p.startsWith("a/") || p.startsWith("b/")) p = p.substring(2);
        return p;
    }
}
