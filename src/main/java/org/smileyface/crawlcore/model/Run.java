package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One execution of a fleet's pipeline. Maps to a row of {@code pipeline_runs}.
 * Runs are never deleted; they form the historical record used for resume selection.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Run {

    private String runId;
    private String fleetName;
    private RunStatus status;
    private Instant startedAt;
    private Instant endedAt;
    private int stepCount;
    private Integer currentStep;

    // Aggregates written by finalize
    private Double totalRuntimeSeconds;
    private Integer slowestStep;
    private String slowestStepName;
    private Integer failureStep;
    private String failureStepName;

    private Long itemsScraped;         // accumulated progress, preferred on resume
    private boolean stopRequested;     // cooperative cancellation flag
    private String errorMessage;
    private Instant updatedAt;         // last run/step mutation, drives stale detection

    public Run() {
    }

    public Run(Run other) {
        this.runId = other.runId;
        this.fleetName = other.fleetName;
        this.status = other.status;
        this.startedAt = other.startedAt;
        this.endedAt = other.endedAt;
        this.stepCount = other.stepCount;
        this.currentStep = other.currentStep;
        this.totalRuntimeSeconds = other.totalRuntimeSeconds;
        this.slowestStep = other.slowestStep;
        this.slowestStepName = other.slowestStepName;
        this.failureStep = other.failureStep;
        this.failureStepName = other.failureStepName;
        this.itemsScraped = other.itemsScraped;
        this.stopRequested = other.stopRequested;
        this.errorMessage = other.errorMessage;
        this.updatedAt = other.updatedAt;
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getFleetName() { return fleetName; }
    public void setFleetName(String fleetName) { this.fleetName = fleetName; }

    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public int getStepCount() { return stepCount; }
    public void setStepCount(int stepCount) { this.stepCount = stepCount; }

    public Integer getCurrentStep() { return currentStep; }
    public void setCurrentStep(Integer currentStep) { this.currentStep = currentStep; }

    public Double getTotalRuntimeSeconds() { return totalRuntimeSeconds; }
    public void setTotalRuntimeSeconds(Double totalRuntimeSeconds) { this.totalRuntimeSeconds = totalRuntimeSeconds; }

    public Integer getSlowestStep() { return slowestStep; }
    public void setSlowestStep(Integer slowestStep) { this.slowestStep = slowestStep; }

    public String getSlowestStepName() { return slowestStepName; }
    public void setSlowestStepName(String slowestStepName) { this.slowestStepName = slowestStepName; }

    public Integer getFailureStep() { return failureStep; }
    public void setFailureStep(Integer failureStep) { this.failureStep = failureStep; }

    public String getFailureStepName() { return failureStepName; }
    public void setFailureStepName(String failureStepName) { this.failureStepName = failureStepName; }

    public Long getItemsScraped() { return itemsScraped; }
    public void setItemsScraped(Long itemsScraped) { this.itemsScraped = itemsScraped; }

    public boolean isStopRequested() { return stopRequested; }
    public void setStopRequested(boolean stopRequested) { this.stopRequested = stopRequested; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Run{" +
                "runId='" + runId + '\'' +
                ", fleetName='" + fleetName + '\'' +
                ", status=" + status +
                ", currentStep=" + currentStep +
                ", stepCount=" + stepCount +
                ", itemsScraped=" + itemsScraped +
                '}';
    }
}
