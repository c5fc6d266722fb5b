package com.agentflow.runner.executor.diff;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a unified diff inside agent output.
 *
 * A fenced {@code ```diff} (or {@code ```patch}) block wins; otherwise the
 * text from the first {@code diff --git} header (or bare {@code --- } line)
 * that leads into a {@code --- }/{@code +++ } pair is taken as the diff.
 */
public class DiffExtractor {

    private static final Pattern FENCED = Pattern.compile(
            "```(?:diff|patch)[ \\t]*\\r?\\n(.*?)\\r?\\n```",
            Pattern.DOTALL);

    // "diff --git" plus its extended header lines, then the ---/+++ pair
    private static final Pattern RAW_START = Pattern.compile(
            "^(?:diff --git .*\\n(?:(?:index|new file mode|deleted file mode|old mode|new mode"
                    + "|similarity index|rename from|rename to) .*\\n)*)?--- .*\\n\\+\\+\\+ ",
            Pattern.MULTILINE);

    private DiffExtractor() {}

    public static Optional<String> extract(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Matcher fenced = FENCED.matcher(text);
        if (fenced.find()) {
            return Optional.of(fenced.group(1) + "\n");
        }
        Matcher raw = RAW_START.matcher(text.replace("\r\n", "\n"));
        if (raw.find()) {
            String diff = text.replace("\r\n", "\n").substring(raw.start());
            return Optional.of(diff.endsWith("\n") ? diff : diff + "\n");
        }
        return Optional.empty();
    }
}
