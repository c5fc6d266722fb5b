package com.agentflow.runner.service;

import com.agentflow.runner.artifact.RunDirectory;
import com.agentflow.runner.model.RunState;
import com.agentflow.runner.model.RunStatus;
import com.agentflow.runner.model.StepDefinition;
import com.agentflow.runner.model.StepResult;
import com.agentflow.runner.model.StepStatus;
import com.agentflow.runner.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Owns the run state machine:
 * <pre>
 *   INITIALIZED → RUNNING → COMPLETED
 *                         ↘ FAILED → (resume) → RUNNING
 * </pre>
 * Every transition is persisted to {@code run-state.json} before the
 * method returns, so the file on disk is never behind the last step.
 */
@Service
public class RunStateManager {

    private static final Logger log = LoggerFactory.getLogger(RunStateManager.class);

    private final Clock clock;

    public RunStateManager(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public RunState initialize(RunDirectory dir, WorkflowDefinition workflow, Path workflowDir) {
        RunState state = new RunState(dir.runId(), workflow,
                workflowDir.toAbsolutePath().normalize().toString(), clock.instant());
        dir.saveRunState(state);
        log.info("Initialized run {} for workflow '{}' ({} steps)",
                dir.runId(), workflow.name(), workflow.steps().size());
        return state;
    }

    public void start(RunState state, RunDirectory dir) {
        state.setStatus(RunStatus.RUNNING);
        state.setEndTime(null);
        dir.saveRunState(state);
    }

    /**
     * Record the result of the step at {@code currentStepIndex} and move on.
     *
     * A blocking failure fails the run and leaves the index on the failed
     * step, which is where a plain resume picks up. Processing the last
     * step completes the run.
     */
    public void advance(RunState state, StepResult result, RunDirectory dir) {
        String expected = state.currentStepId().orElseThrow(() ->
                new IllegalStateException("Run " + state.getRunId() + " has no step left to advance"));
        if (!expected.equals(result.stepId())) {
            throw new IllegalStateException("Result for step '" + result.stepId()
                    + "' but the current step is '" + expected + "'");
        }

        state.getStepResults().add(result);
        if (result.haltsRun()) {
            state.setStatus(RunStatus.FAILED);
            state.setEndTime(clock.instant());
        } else {
            state.setCurrentStepIndex(state.getCurrentStepIndex() + 1);
            if (state.getCurrentStepIndex() >= state.getWorkflowSnapshot().steps().size()) {
                state.setStatus(RunStatus.COMPLETED);
                state.setEndTime(clock.instant());
            }
        }
        dir.saveRunState(state);
    }

    /** Fail the run without a step result, e.g. when the runtime ceiling is hit between steps. */
    public void fail(RunState state, RunDirectory dir, String reason) {
        state.setStatus(RunStatus.FAILED);
        state.setEndTime(clock.instant());
        dir.saveRunState(state);
        log.warn("Run {} failed before step {}: {}", state.getRunId(),
                state.currentStepId().orElse("-"), reason);
    }

    // ------------------------------------------------------------------
    // Resume
    // ------------------------------------------------------------------

    /**
     * Load a run and rewind it to the resume point.
     *
     * With {@code fromStepId} the run restarts at that step; without it, at
     * the first step that has no completed result. Results from the resume
     * point on are dropped and their artifacts archived, then the run is
     * RUNNING again.
     *
     * @throws ResumeException if the run or the step does not exist, or there is nothing to resume
     */
    public RunState prepareResume(RunDirectory dir, String fromStepId) {
        RunState state = dir.loadRunState().orElseThrow(() ->
                new ResumeException("No run '" + dir.runId() + "' found under " + dir.root().getParent()));
        List<StepDefinition> steps = state.getWorkflowSnapshot().steps();
        List<StepResult> results = state.getStepResults();

        int index;
        if (fromStepId != null) {
            index = state.getWorkflowSnapshot().indexOf(fromStepId);
            if (index < 0) {
                throw new ResumeException("Run " + state.getRunId() + " has no step '" + fromStepId
                        + "'; steps are " + state.getWorkflowSnapshot().stepIds());
            }
            if (index > results.size()) {
                throw new ResumeException("Cannot resume from '" + fromStepId + "': earlier step '"
                        + steps.get(results.size()).id() + "' has not run yet");
            }
        } else {
            index = firstIncomplete(results, steps.size());
            if (index >= steps.size()) {
                throw new ResumeException("Run " + state.getRunId() + " already completed every step");
            }
        }

        // past this point every check has passed; start mutating
        for (int i = index; i < steps.size(); i++) {
            dir.archiveStep(steps.get(i).id());
        }
        results.subList(Math.min(index, results.size()), results.size()).clear();
        state.setCurrentStepIndex(index);
        log.info("Resuming run {} from step {} ({}/{})",
                state.getRunId(), steps.get(index).id(), index + 1, steps.size());
        start(state, dir);
        return state;
    }

    private static int firstIncomplete(List<StepResult> results, int stepCount) {
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i).status() != StepStatus.COMPLETED) return i;
        }
        return Math.min(results.size(), stepCount);
    }
}
