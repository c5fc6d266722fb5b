package com.agentflow.runner.artifact;

/**
 * Thrown when an artifact or the run state cannot be persisted.
 *
 * Always fatal: persistence is what makes a run auditable and resumable,
 * so the runner never continues past a failed write.
 */
public class ArtifactWriteException extends RuntimeException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
