package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One claimable unit of work. The payload is opaque to the core.
 * Maps to a row of {@code work_items}; {@code (run_id, natural_key)} is unique.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkItem {

    private long itemId;
    private String runId;
    private int stepNumber;
    private String naturalKey;
    private byte[] payload;
    private int priority;
    private WorkItemStatus status = WorkItemStatus.PENDING;
    private String claimedBy;
    private Instant claimedAt;
    private Instant heartbeatAt;
    private int attemptCount;
    private int maxAttempts;
    private String lastError;
    private byte[] result;
    private Instant enqueuedAt;
    private Instant completedAt;

    public WorkItem() {
    }

    public WorkItem(WorkItem other) {
        this.itemId = other.itemId;
        this.runId = other.runId;
        this.stepNumber = other.stepNumber;
        this.naturalKey = other.naturalKey;
        this.payload = other.payload == null ? null : other.payload.clone();
        this.priority = other.priority;
        this.status = other.status;
        this.claimedBy = other.claimedBy;
        this.claimedAt = other.claimedAt;
        this.heartbeatAt = other.heartbeatAt;
        this.attemptCount = other.attemptCount;
        this.maxAttempts = other.maxAttempts;
        this.lastError = other.lastError;
        this.result = other.result == null ? null : other.result.clone();
        this.enqueuedAt = other.enqueuedAt;
        this.completedAt = other.completedAt;
    }

    public long getItemId() { return itemId; }
    public void setItemId(long itemId) { this.itemId = itemId; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public int getStepNumber() { return stepNumber; }
    public void setStepNumber(int stepNumber) { this.stepNumber = stepNumber; }

    public String getNaturalKey() { return naturalKey; }
    public void setNaturalKey(String naturalKey) { this.naturalKey = naturalKey; }

    public byte[] getPayload() { return payload; }
    public void setPayload(byte[] payload) { this.payload = payload; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public WorkItemStatus getStatus() { return status; }
    public void setStatus(WorkItemStatus status) { this.status = status; }

    public String getClaimedBy() { return claimedBy; }
    public void setClaimedBy(String claimedBy) { this.claimedBy = claimedBy; }

    public Instant getClaimedAt() { return claimedAt; }
    public void setClaimedAt(Instant claimedAt) { this.claimedAt = claimedAt; }

    public Instant getHeartbeatAt() { return heartbeatAt; }
    public void setHeartbeatAt(Instant heartbeatAt) { this.heartbeatAt = heartbeatAt; }

    public int getAttemptCount() { return attemptCount; }
    public void setAttemptCount(int attemptCount) { this.attemptCount = attemptCount; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public byte[] getResult() { return result; }
    public void setResult(byte[] result) { this.result = result; }

    public Instant getEnqueuedAt() { return enqueuedAt; }
    public void setEnqueuedAt(Instant enqueuedAt) { this.enqueuedAt = enqueuedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    @Override
    public String toString() {
        return "WorkItem{" +
                "itemId=" + itemId +
                ", runId='" + runId + '\'' +
                ", naturalKey='" + naturalKey + '\'' +
                ", status=" + status +
                ", claimedBy='" + claimedBy + '\'' +
                ", attemptCount=" + attemptCount +
                '}';
    }
}
