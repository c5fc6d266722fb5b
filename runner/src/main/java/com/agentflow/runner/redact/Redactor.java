package com.agentflow.runner.redact;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces credential-shaped substrings with {@link #MASK}.
 *
 * Pure text transform, applied by the artifact store to everything it
 * writes. Never applied to inputs of policy decisions.
 */
@Component
public class Redactor {

    public static final String MASK = "***REDACTED***";

    /**
     * A pattern plus the capture group that holds the secret. Group 0 means
     * the whole match is replaced; otherwise only that group is.
     */
    private record Rule(Pattern pattern, int secretGroup) {}

    private static final List<Rule> RULES = List.of(
            // Anthropic / OpenAI style API keys
            new Rule(Pattern.compile("sk-(?:ant-)?[A-Za-z0-9_\\-]{20,}"), 0),
            // Authorization: Bearer <token>
            new Rule(Pattern.compile("(?i)\\bBearer\\s+([A-Za-z0-9\\-._~+/]{8,}=*)"), 1),
            // AWS access key ids
            new Rule(Pattern.compile("\\b(?:AKIA|ASIA)[A-Z0-9]{16}\\b"), 0),
            // aws_secret_access_key = <40 chars>
            new Rule(Pattern.compile("(?i)aws_secret_access_key[\"']?\\s*[:=]\\s*[\"']?([A-Za-z0-9/+=]{40})"), 1),
            // GitHub tokens
            new Rule(Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{36,}\\b"), 0),
            // password / api_key / secret / token assignments
            new Rule(Pattern.compile(
                    "(?i)\\b(?:password|passwd|api[_-]?key|secret|token)[\"']?\\s*[:=]\\s*[\"']([^\"'\\s]{4,})[\"']"), 1)
    );

    public String redact(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = text;
        for (Rule rule : RULES) {
            out = apply(rule, out);
        }
        return out;
    }

    /** True if {@link #redact} would change the text. */
    public boolean containsSecret(String text) {
        return text != null && !text.equals(redact(text));
    }

    private static String apply(Rule rule, String text) {
        Matcher m = rule.pattern().matcher(text);
        if (!m.find()) return text;
        StringBuilder sb = new StringBuilder();
        do {
            if (rule.secretGroup() == 0) {
                m.appendReplacement(sb, Matcher.quoteReplacement(MASK));
            } else {
                String whole   = m.group();
                int    start   = m.start(rule.secretGroup()) - m.start();
                int    end     = m.end(rule.secretGroup()) - m.start();
                String masked  = whole.substring(0, start) + MASK + whole.substring(end);
                m.appendReplacement(sb, Matcher.quoteReplacement(masked));
            }
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }
}
