package com.agentflow.runner.diagram;

import java.util.Arrays;
import java.util.Optional;

public enum DiagramFormat {
    DOT("dot"),
    MERMAID("mmd");

    private final String extension;

    DiagramFormat(String extension) {
        this.extension = extension;
    }

    public String extension() { return extension; }

    public static Optional<DiagramFormat> parse(String value) {
        return Arrays.stream(values())
                .filter(f -> f.name().equalsIgnoreCase(value) || f.extension.equalsIgnoreCase(value))
                .findFirst();
    }
}
