package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One ordered stage of a run. Maps to a row of {@code pipeline_steps}, keyed by
 * {@code (run_id, step_number)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Step {

    private String runId;
    private int stepNumber;
    private String name;
    private StepStatus status = StepStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private Double durationSeconds;
    private StepMetrics metrics = StepMetrics.EMPTY;
    private String errorMessage;
    private String logPath;

    public Step() {
    }

    public Step(String runId, int stepNumber, String name) {
        this.runId = runId;
        this.stepNumber = stepNumber;
        this.name = name;
    }

    public Step(Step other) {
        this.runId = other.runId;
        this.stepNumber = other.stepNumber;
        this.name = other.name;
        this.status = other.status;
        this.startedAt = other.startedAt;
        this.completedAt = other.completedAt;
        this.durationSeconds = other.durationSeconds;
        this.metrics = other.metrics;
        this.errorMessage = other.errorMessage;
        this.logPath = other.logPath;
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public int getStepNumber() { return stepNumber; }
    public void setStepNumber(int stepNumber) { this.stepNumber = stepNumber; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public StepStatus getStatus() { return status; }
    public void setStatus(StepStatus status) { this.status = status; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Double getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Double durationSeconds) { this.durationSeconds = durationSeconds; }

    public StepMetrics getMetrics() { return metrics; }
    public void setMetrics(StepMetrics metrics) { this.metrics = metrics == null ? StepMetrics.EMPTY : metrics; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getLogPath() { return logPath; }
    public void setLogPath(String logPath) { this.logPath = logPath; }

    @Override
    public String toString() {
        return "Step{" + runId + "#" + stepNumber + " '" + name + "' " + status + '}';
    }
}
