package com.agentflow.runner.artifact;

import com.agentflow.runner.redact.Redactor;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Streams a step transcript to disk one chunk at a time.
 *
 * Every chunk is redacted before it is written. Content accumulates in
 * {@code transcript.md.partial} and is moved to {@code transcript.md} on
 * {@link #close()}, after which the transcript is immutable.
 */
public class TranscriptWriter implements Closeable {

    private final Path           target;
    private final Path           partial;
    private final Redactor       redactor;
    private final BufferedWriter out;
    private boolean              closed;

    TranscriptWriter(Path target, Redactor redactor) {
        this.target   = target;
        this.partial  = target.resolveSibling(target.getFileName() + ".partial");
        this.redactor = redactor;
        try {
            this.out = Files.newBufferedWriter(partial, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not open transcript " + partial, e);
        }
    }

    /** Append one line (a newline is added). */
    public synchronized void appendLine(String line) {
        append(line + "\n");
    }

    public synchronized void append(String chunk) {
        if (closed) {
            throw new ArtifactWriteException("Transcript already closed: " + target);
        }
        try {
            out.write(redactor.redact(chunk));
            out.flush();
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not append to transcript " + partial, e);
        }
    }

    public Path path() { return target; }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            out.close();
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not finalize transcript " + target, e);
        }
    }
}
