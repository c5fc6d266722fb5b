package com.agentflow.runner.process;

/**
 * Receives each line of a subprocess's merged output on the reader thread.
 * The session is passed along so a handler can stop the process.
 */
@FunctionalInterface
public interface OutputHandler {
    void onLine(String line, SubprocessSession session);
}
