package org.smileyface.crawlcore.queue;

/**
 * Everything needed to enqueue one work item.
 *
 * @param naturalKey  caller-derived identity; unique within the run across all of its steps
 * @param maxAttempts claims allowed before the item is dead-lettered
 */
public record WorkItemRequest(String runId, int stepNumber, String naturalKey, byte[] payload, int priority, int maxAttempts) {

    public WorkItemRequest {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        if (naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("naturalKey must not be blank");
        }
        if (stepNumber < 0) {
            throw new IllegalArgumentException("stepNumber must be >= 0, was " + stepNumber);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
    }
}
