package com.agentflow.runner.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits shell command lines into the executables they would run.
 *
 * Only the shapes the allowlist needs are understood: chains joined by
 * {@code &&}, {@code ||}, {@code ;}, {@code |} or newlines, and leading
 * {@code VAR=value} assignments. Quoting is honoured for separators.
 */
public final class CommandLines {

    private static final Pattern ASSIGNMENT = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*=.*");

    private CommandLines() {}

    /** True if the line uses command substitution, which hides the real executable. */
    public static boolean hasSubstitution(String commandLine) {
        return commandLine.contains("$(") || commandLine.contains("`");
    }

    /** Executable basenames of every segment, in order. Empty segments are dropped. */
    public static List<String> executables(String commandLine) {
        List<String> result = new ArrayList<>();
        for (String segment : segments(commandLine)) {
            String exe = firstWord(segment);
            if (exe != null) {
                int slash = exe.lastIndexOf('/');
                result.add(slash >= 0 ? exe.substring(slash + 1) : exe);
            }
        }
        return result;
    }

    static List<String> segments(String commandLine) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == ';' || c == '|' || c == '&' || c == '\n') {
                // "&&", "||" collapse into a single boundary; a lone "&" backgrounds
                segments.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        segments.add(current.toString());
        return segments.stream().map(String::strip).filter(s -> !s.isEmpty()).toList();
    }

    private static String firstWord(String segment) {
        for (String word : segment.split("\\s+")) {
            String w = stripQuotes(word);
            if (w.isEmpty() || ASSIGNMENT.matcher(w).matches()) continue;
            if (w.startsWith("(") || w.startsWith("{")) {
                w = w.substring(1);
                if (w.isEmpty()) continue;
            }
            return w;
        }
        return null;
    }

    private static String stripQuotes(String word) {
        if (word.length() >= 2
                && (word.startsWith("\"") && word.endsWith("\"") || word.startsWith("'") && word.endsWith("'"))) {
            return word.substring(1, word.length() - 1);
        }
        return word;
    }
}
