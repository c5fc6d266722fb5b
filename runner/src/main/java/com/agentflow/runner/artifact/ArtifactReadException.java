package com.agentflow.runner.artifact;

/** Thrown when a persisted artifact exists but cannot be read or parsed. */
public class ArtifactReadException extends RuntimeException {

    public ArtifactReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
