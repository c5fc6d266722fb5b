package com.agentflow.runner.executor;

import com.agentflow.runner.artifact.ArtifactWriteException;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Type-keyed registry of step executors.
 *
 * Every {@link StepExecutor} bean is collected at startup. Execution through
 * {@link #execute} is timed and counted:
 * <pre>
 *   agentflow.step.duration{type}
 *   agentflow.step.executions{type, status="completed|failed|skipped|error"}
 * </pre>
 */
@Component
public class StepExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepExecutorRegistry.class);

    private final Map<StepType, StepExecutor> executors = new EnumMap<>(StepType.class);
    private final MeterRegistry meterRegistry;

    public StepExecutorRegistry(List<StepExecutor> allExecutors, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StepExecutor executor : allExecutors) {
            StepExecutor previous = executors.put(executor.type(), executor);
            if (previous != null) {
                throw new IllegalStateException("Two executors registered for step type '"
                        + executor.type().yamlName() + "': " + previous.getClass().getSimpleName()
                        + " and " + executor.getClass().getSimpleName());
            }
            log.debug("Registered executor {} for step type '{}'",
                    executor.getClass().getSimpleName(), executor.type().yamlName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public StepExecutor get(StepType type) {
        StepExecutor executor = executors.get(type);
        if (executor == null) {
            throw new StepExecutorNotFoundException(type);
        }
        return executor;
    }

    public boolean supports(StepType type) {
        return executors.containsKey(type);
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * @throws StepExecutionException for environment and executor errors, including
     *                                unexpected runtime exceptions from an executor
     * @throws ArtifactWriteException if an artifact could not be written
     */
    public StepResult execute(StepDefinition step, RunContext ctx) {
        String typeTag = step.type().yamlName();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            StepResult result = get(step.type()).execute(step, ctx);
            status = result.status().name().toLowerCase();
            return result;
        } catch (StepExecutionException | ArtifactWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StepExecutionException("Unexpected error in " + typeTag + " step '"
                    + step.id() + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("agentflow.step.duration", "type", typeTag));
            meterRegistry.counter("agentflow.step.executions",
                    "type", typeTag, "status", status).increment();
        }
    }
}
