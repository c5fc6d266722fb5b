package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Workflow-level limits from the {@code env} block.
 *
 * @param maxTotalRuntimeSeconds soft ceiling checked between steps; null means unlimited
 * @param artifactsDirTemplate   overrides the configured artifacts directory;
 *                               may contain {@code ${RUN_ID}}
 * @param seed                   passed through to the agent environment when set
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeLimits(
        @JsonProperty("max_runtime_seconds") Integer maxTotalRuntimeSeconds,
        @JsonProperty("artifacts_dir")       String  artifactsDirTemplate,
        @JsonProperty("seed")                Long    seed) {

    public static RuntimeLimits none() {
        return new RuntimeLimits(null, null, null);
    }
}
