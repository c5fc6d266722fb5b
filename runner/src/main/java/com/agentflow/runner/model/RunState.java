package com.agentflow.runner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Canonical state of one run, persisted as {@code run-state.json}.
 *
 * Mutated only through {@code RunStateManager}, which persists it after
 * every change. {@code stepResults} holds one entry per executed step in
 * declared order; resume truncates it at the resume index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunState {

    private String             runId;
    private WorkflowDefinition workflowSnapshot;

    // Directory of the original workflow file; prompt files resolve against it.
    private String             workflowDir;

    private int                currentStepIndex;
    private RunStatus          status = RunStatus.INITIALIZED;
    private List<StepResult>   stepResults = new ArrayList<>();
    private Instant            startTime;
    private Instant            endTime;

    protected RunState() {}   // required by Jackson

    public RunState(String runId, WorkflowDefinition workflow, String workflowDir, Instant startTime) {
        this.runId            = runId;
        this.workflowSnapshot = workflow;
        this.workflowDir      = workflowDir;
        this.startTime        = startTime;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String             getRunId()            { return runId; }
    public WorkflowDefinition getWorkflowSnapshot() { return workflowSnapshot; }
    public String             getWorkflowDir()      { return workflowDir; }
    public int                getCurrentStepIndex() { return currentStepIndex; }
    public RunStatus          getStatus()           { return status; }
    public List<StepResult>   getStepResults()      { return stepResults; }
    public Instant            getStartTime()        { return startTime; }
    public Instant            getEndTime()          { return endTime; }

    public void setCurrentStepIndex(int currentStepIndex) { this.currentStepIndex = currentStepIndex; }
    public void setStatus(RunStatus status)               { this.status = status; }
    public void setEndTime(Instant endTime)               { this.endTime = endTime; }

    void setRunId(String runId)                               { this.runId = runId; }
    void setWorkflowSnapshot(WorkflowDefinition workflow)     { this.workflowSnapshot = workflow; }
    void setWorkflowDir(String workflowDir)                   { this.workflowDir = workflowDir; }
    void setStartTime(Instant startTime)                      { this.startTime = startTime; }
    void setStepResults(List<StepResult> stepResults)         { this.stepResults = new ArrayList<>(stepResults); }

    // ------------------------------------------------------------------
    // Derived views
    // ------------------------------------------------------------------

    @JsonIgnore
    public Optional<StepResult> resultFor(String stepId) {
        return stepResults.stream().filter(r -> r.stepId().equals(stepId)).findFirst();
    }

    /** Id of the step at {@link #currentStepIndex}, if the index is in range. */
    @JsonIgnore
    public Optional<String> currentStepId() {
        List<StepDefinition> steps = workflowSnapshot.steps();
        return currentStepIndex >= 0 && currentStepIndex < steps.size()
                ? Optional.of(steps.get(currentStepIndex).id())
                : Optional.empty();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status == RunStatus.COMPLETED || status == RunStatus.FAILED;
    }

    @JsonIgnore
    public long countByStatus(StepStatus s) {
        return stepResults.stream().filter(r -> r.status() == s).count();
    }
}
