package com.agentflow.runner.workflow;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} placeholders in workflow values.
 *
 * Unresolved placeholders are left in place so the caller can tell that
 * a variable was missing.
 */
public final class Placeholders {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private Placeholders() {}

    public static String expand(String value, UnaryOperator<String> lookup) {
        if (value == null) return null;
        Matcher m = PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String resolved = lookup.apply(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static boolean hasPlaceholder(String value) {
        return value != null && PLACEHOLDER.matcher(value).find();
    }
}
