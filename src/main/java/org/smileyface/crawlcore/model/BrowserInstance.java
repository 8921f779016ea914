package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Bookkeeping record of a spawned browser/rendering process.
 * The record is authoritative for whether the process should still be alive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BrowserInstance {

    public static final String REASON_COMPLETED = "completed";
    public static final String REASON_CRASH = "crash";
    public static final String REASON_ORPHAN_CLEANUP = "orphan_cleanup";

    private long instanceId;
    private String runId;
    private int stepNumber;
    private long threadId;
    private long processId;
    private Long parentProcessId;
    private Instant startedAt;
    private Instant terminatedAt;
    private String terminationReason;

    public BrowserInstance() {
    }

    public BrowserInstance(BrowserInstance other) {
        this.instanceId = other.instanceId;
        this.runId = other.runId;
        this.stepNumber = other.stepNumber;
        this.threadId = other.threadId;
        this.processId = other.processId;
        this.parentProcessId = other.parentProcessId;
        this.startedAt = other.startedAt;
        this.terminatedAt = other.terminatedAt;
        this.terminationReason = other.terminationReason;
    }

    public boolean isActive() {
        return terminatedAt == null;
    }

    public long getInstanceId() { return instanceId; }
    public void setInstanceId(long instanceId) { this.instanceId = instanceId; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public int getStepNumber() { return stepNumber; }
    public void setStepNumber(int stepNumber) { this.stepNumber = stepNumber; }

    public long getThreadId() { return threadId; }
    public void setThreadId(long threadId) { this.threadId = threadId; }

    public long getProcessId() { return processId; }
    public void setProcessId(long processId) { this.processId = processId; }

    public Long getParentProcessId() { return parentProcessId; }
    public void setParentProcessId(Long parentProcessId) { this.parentProcessId = parentProcessId; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getTerminatedAt() { return terminatedAt; }
    public void setTerminatedAt(Instant terminatedAt) { this.terminatedAt = terminatedAt; }

    public String getTerminationReason() { return terminationReason; }
    public void setTerminationReason(String terminationReason) { this.terminationReason = terminationReason; }

    @Override
    public String toString() {
        return "BrowserInstance{" +
                "instanceId=" + instanceId +
                ", runId='" + runId + '\'' +
                ", stepNumber=" + stepNumber +
                ", processId=" + processId +
                ", terminationReason='" + terminationReason + '\'' +
                '}';
    }
}
