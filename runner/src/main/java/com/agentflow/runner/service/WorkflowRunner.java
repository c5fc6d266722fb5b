package com.agentflow.runner.service;

import com.agentflow.runner.artifact.ArtifactStore;
import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.artifact.RunIdGenerator;
import com.agentflow.runner.executor.RunContext;
import com.agentflow.runner.executor.StepExecutionException;
import com.agentflow.runner.executor.StepExecutorRegistry;
import com.agentflow.runner.model.FailureKind;
import com.agentflow.runner.model.RunState;
import com.agentflow.runner.model.RunStatus;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.WorkflowDefinition;
import com.agentflow.runner.workflow.WorkflowLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Executes workflows step by step, strictly in declared order.
 *
 * For each pending step: resolve the executor, execute, downgrade the
 * failure to non-blocking if the step says {@code on_error: continue},
 * then hand the result to {@link RunStateManager#advance}. A blocking
 * failure stops the run and the outcome names the step to resume from.
 */
@Service
public class WorkflowRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final WorkflowLoader       loader;
    private final ArtifactStore        artifacts;
    private final RunIdGenerator       runIds;
    private final RunStateManager      states;
    private final StepExecutorRegistry executors;
    private final Clock                clock;
    private final Path                 workspaceRoot;

    @Autowired
    public WorkflowRunner(WorkflowLoader loader,
                          ArtifactStore artifacts,
                          RunIdGenerator runIds,
                          RunStateManager states,
                          StepExecutorRegistry executors,
                          Clock clock,
                          @Value("${agentflow.workspace:.}") String workspace) {
        this(loader, artifacts, runIds, states, executors, clock, Path.of(workspace));
    }

    public WorkflowRunner(WorkflowLoader loader, ArtifactStore artifacts, RunIdGenerator runIds,
                          RunStateManager states, StepExecutorRegistry executors, Clock clock,
                          Path workspaceRoot) {
        this.loader        = loader;
        this.artifacts     = artifacts;
        this.runIds        = runIds;
        this.states        = states;
        this.executors     = executors;
        this.clock         = clock;
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Validate and describe what a run would do, without creating anything.
     *
     * @throws com.agentflow.runner.workflow.WorkflowValidationException if the workflow is invalid
     */
    public List<String> dryRun(Path workflowFile) {
        WorkflowDefinition workflow = loader.load(workflowFile);
        List<String> plan = new ArrayList<>();
        List<StepDefinition> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            StringBuilder line = new StringBuilder()
                    .append(i + 1).append(". ").append(step.id())
                    .append(" [").append(step.type().yamlName()).append(']');
            switch (step.type()) {
                case PROMPT     -> line.append(" prompt_file=").append(step.promptFile());
                case COMMAND    -> line.append(" $ ").append(step.command());
                case AGENT      -> line.append(" timeout=").append(step.policy().timeoutSeconds()).append('s')
                                       .append(" max_edits=").append(step.policy().maxEdits());
                case APPLY_DIFF -> line.append(" approve=").append(step.approve());
                case CUSTOM     -> { }
            }
            if (step.continueOnError()) line.append(" (on_error: continue)");
            if (!executors.supports(step.type())) line.append(" (no executor registered)");
            plan.add(line.toString());
        }
        return plan;
    }

    /**
     * Start a new run.
     *
     * @throws com.agentflow.runner.workflow.WorkflowValidationException before anything is written
     */
    public RunOutcome run(Path workflowFile, RunOptions options, RunProgressListener listener) {
        WorkflowDefinition workflow = loader.load(workflowFile);
        String runId = runIds.next();
        RunDirectory dir = artifacts.create(runId, workflow.runtimeLimits().artifactsDirTemplate(),
                options.artifactsRoot());
        RunState state = states.initialize(dir, workflow, workflowFile.toAbsolutePath().getParent());
        states.start(state, dir);
        return execute(state, dir, options, listener);
    }

    /**
     * Continue a run from {@code fromStepId}, or from its first incomplete step.
     *
     * @throws ResumeException before anything is written
     */
    public RunOutcome resume(String runId, String fromStepId, RunOptions options, RunProgressListener listener) {
        RunDirectory dir = artifacts.open(runId, options.artifactsRoot());
        RunState state = states.prepareResume(dir, fromStepId);
        return execute(state, dir, options, listener);
    }

    // ------------------------------------------------------------------
    // Step loop
    // ------------------------------------------------------------------

    private RunOutcome execute(RunState state, RunDirectory dir, RunOptions options, RunProgressListener listener) {
        WorkflowDefinition workflow = state.getWorkflowSnapshot();
        List<StepDefinition> steps = workflow.steps();
        RunContext ctx = new RunContext(state.getRunId(), workflow, dir, workspaceRoot,
                Path.of(state.getWorkflowDir()), options.approveAll());

        MDC.put("runId", state.getRunId());
        try {
            listener.runStarted(state.getRunId(), workflow, dir.root());
            Instant began = clock.instant();
            String haltMessage = null;
            boolean firstStep = true;

            while (state.getStatus() == RunStatus.RUNNING) {
                int index = state.getCurrentStepIndex();
                StepDefinition step = steps.get(index);

                if (!firstStep && ceilingReached(workflow, began)) {
                    haltMessage = "Workflow exceeded max_runtime_seconds="
                            + workflow.runtimeLimits().maxTotalRuntimeSeconds() + " before step '" + step.id() + "'";
                    states.fail(state, dir, haltMessage);
                    break;
                }
                firstStep = false;

                listener.stepStarted(index, steps.size(), step);
                StepResult result = executeStep(step, ctx);
                states.advance(state, result, dir);
                listener.stepFinished(step, result);
                if (result.haltsRun()) {
                    haltMessage = result.errorMessage();
                }
            }

            RunOutcome outcome = outcome(state, dir, haltMessage);
            if (outcome.succeeded()) {
                log.info("Run {} completed ({} step results)", state.getRunId(), state.getStepResults().size());
            } else {
                log.warn("Run {} failed; resume with: {}", state.getRunId(), outcome.resumeCommand());
            }
            listener.runFinished(outcome);
            return outcome;
        } finally {
            MDC.clear();
        }
    }

    private StepResult executeStep(StepDefinition step, RunContext ctx) {
        MDC.put("stepId",   step.id());
        MDC.put("stepType", step.type().yamlName());
        Instant start = clock.instant();
        try {
            log.info("Starting step {} ({})", step.id(), step.type().yamlName());
            StepResult result;
            try {
                result = executors.execute(step, ctx);
            } catch (StepExecutionException e) {
                log.error("Step {} could not be executed: {}", step.id(), e.getMessage(), e);
                result = StepResult.failed(step.id(), FailureKind.EXECUTOR_ERROR, null, start, clock.instant(),
                        null, e.getMessage());
            }
            if (result.isFailed() && step.continueOnError()) {
                log.warn("Step {} failed ({}), continuing: {}", step.id(),
                        result.failureKind().jsonName(), result.errorMessage());
                result = result.nonBlocking();
            } else if (result.isFailed()) {
                log.warn("Step {} failed ({}): {}", step.id(), result.failureKind().jsonName(), result.errorMessage());
            } else {
                log.info("Step {} {}", step.id(), result.status().jsonName());
            }
            return result;
        } finally {
            MDC.remove("stepId");
            MDC.remove("stepType");
        }
    }

    private boolean ceilingReached(WorkflowDefinition workflow, Instant began) {
        Integer max = workflow.runtimeLimits().maxTotalRuntimeSeconds();
        return max != null && Duration.between(began, clock.instant()).toSeconds() >= max;
    }

    private RunOutcome outcome(RunState state, RunDirectory dir, String haltMessage) {
        Path root = dir.root().getParent();
        Path artifactsRoot = root.equals(artifacts.defaultRoot().toAbsolutePath().normalize()) ? null : root;
        if (state.getStatus() == RunStatus.COMPLETED) {
            return new RunOutcome(state.getRunId(), RunStatus.COMPLETED, dir.root(), artifactsRoot, null, null, null);
        }
        List<StepResult> results = state.getStepResults();
        StepResult last = results.isEmpty() ? null : results.get(results.size() - 1);
        String failedStep = last != null && last.haltsRun() ? last.stepId() : null;
        return new RunOutcome(state.getRunId(), state.getStatus(), dir.root(), artifactsRoot, failedStep,
                state.currentStepId().orElse(null), haltMessage);
    }
}
