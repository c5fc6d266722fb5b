package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The step types a workflow may declare.
 *
 * Each type maps to exactly one registered executor. {@code cmd} and
 * {@code command} are accepted as spellings of the same type.
 */
public enum StepType {
    PROMPT("prompt"),
    AGENT("agent"),
    COMMAND("cmd", "command"),
    APPLY_DIFF("apply_diff"),
    CUSTOM("custom");

    private final String yamlName;
    private final List<String> aliases;

    StepType(String yamlName, String... aliases) {
        this.yamlName = yamlName;
        this.aliases  = List.of(aliases);
    }

    @JsonValue
    public String yamlName() { return yamlName; }

    public static Optional<StepType> fromYaml(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.yamlName.equals(value) || t.aliases.contains(value))
                .findFirst();
    }

    @JsonCreator
    static StepType parse(String value) {
        return fromYaml(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown step type: " + value));
    }

    /** All accepted spellings, used in violation messages. */
    public static List<String> acceptedNames() {
        return Arrays.stream(values())
                .flatMap(t -> java.util.stream.Stream.concat(
                        java.util.stream.Stream.of(t.yamlName), t.aliases.stream()))
                .toList();
    }
}
