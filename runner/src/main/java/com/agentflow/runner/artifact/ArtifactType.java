package com.agentflow.runner.artifact;

/** The per-step artifacts a run directory can hold. */
public enum ArtifactType {
    POLICY("policy.json"),
    TRANSCRIPT("transcript.md"),
    OUTPUT("output.txt"),
    METRICS("metrics.json");

    private final String fileName;

    ArtifactType(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() { return fileName; }
}
