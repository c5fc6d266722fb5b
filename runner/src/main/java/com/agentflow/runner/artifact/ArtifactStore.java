package com.agentflow.runner.artifact;

import com.agentflow.runner.redact.Redactor;
import com.agentflow.runner.workflow.Placeholders;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Resolves and opens run directories.
 *
 * The artifacts root comes from, in order: an explicit override (the CLI's
 * {@code --artifacts-dir}), the workflow's {@code env.artifacts_dir}
 * template, or {@code agentflow.artifacts-dir}. A template ending in
 * {@code /${RUN_ID}} names the run directory itself; otherwise the run id
 * is appended to it. Either way a run lives at {@code <root>/<runId>}.
 */
@Component
public class ArtifactStore {

    private final Path                  defaultRoot;
    private final ObjectMapper          json;
    private final Redactor              redactor;
    private final UnaryOperator<String> env;

    public ArtifactStore(@Value("${agentflow.artifacts-dir:.agentflow_runs}") String defaultRoot,
                         ObjectMapper objectMapper,
                         Redactor redactor) {
        this(Path.of(defaultRoot), objectMapper, redactor, System::getenv);
    }

    public ArtifactStore(Path defaultRoot, ObjectMapper objectMapper, Redactor redactor,
                         UnaryOperator<String> env) {
        this.defaultRoot = defaultRoot;
        this.json        = objectMapper;
        this.redactor    = redactor;
        this.env         = env;
    }

    public Path defaultRoot() { return defaultRoot; }

    /** Directory for a new run. */
    public RunDirectory create(String runId, String artifactsDirTemplate, Path overrideRoot) {
        if (overrideRoot != null) {
            return open(runId, overrideRoot);
        }
        if (artifactsDirTemplate != null && !artifactsDirTemplate.isBlank()) {
            String expanded = Placeholders.expand(artifactsDirTemplate,
                    name -> "RUN_ID".equals(name) ? runId : env.apply(name));
            Path path = Path.of(expanded);
            return artifactsDirTemplate.contains("${RUN_ID}")
                    ? new RunDirectory(runId, path, json, redactor)
                    : open(runId, path);
        }
        return open(runId, defaultRoot);
    }

    /** Existing (or new) run directory {@code <root>/<runId>}; null root means the default. */
    public RunDirectory open(String runId, Path root) {
        Path base = root != null ? root : defaultRoot;
        return new RunDirectory(runId, base.resolve(runId), json, redactor);
    }
}
