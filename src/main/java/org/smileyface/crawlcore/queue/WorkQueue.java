package org.smileyface.crawlcore.queue;

import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.model.WorkItemStatus;

import java.util.List;
import java.util.Optional;

/**
 * Shared backlog of work items with exclusive, expiring claims.
 *
 * Every claim counts as one attempt. Items end as {@code completed} or {@code dead}; a
 * {@code failed} item is waiting to be claimed again.
 */
public interface WorkQueue {

    /**
     * Enqueues with the queue's default step (0) and max attempts.
     *
     * @return false when the natural key already exists in the run
     */
    boolean enqueue(String runId, String naturalKey, byte[] payload, int priority);

    /**
     * @return false when the natural key already exists in the run
     */
    boolean enqueue(WorkItemRequest request);

    /**
     * @return number of items actually inserted
     */
    default int enqueueAll(List<WorkItemRequest> requests) {
        int inserted = 0;
        for (WorkItemRequest r : requests) {
            if (enqueue(r)) inserted++;
        }
        return inserted;
    }

    /**
     * Claims up to {@code batchSize} items of any run using the queue's default heartbeat expiry.
     */
    List<WorkItem> claimNext(String workerId, int batchSize);

    /**
     * Atomically claims up to {@code batchSize} pending, failed or stale-claimed items in the
     * scope, highest priority first then oldest. No two callers ever receive the same item
     * while its claim is live.
     */
    List<WorkItem> claimNext(ClaimScope scope, String workerId, int batchSize);

    HeartbeatResult heartbeat(long itemId, String workerId);

    /**
     * @return false when the caller no longer holds the claim; nothing is changed then
     */
    boolean complete(long itemId, String workerId, byte[] result);

    /**
     * Ends the current attempt with an error. The item becomes {@code dead} once its attempts
     * are used up, otherwise {@code failed} and claimable again.
     *
     * @return the new status, empty when the caller no longer holds the claim
     */
    Optional<WorkItemStatus> fail(long itemId, String workerId, String error);

    /**
     * Dead-letters the item regardless of attempts left.
     */
    boolean markDead(long itemId, String workerId, String error);

    /**
     * Hands the claim back without consuming an attempt.
     */
    boolean release(long itemId, String workerId);

    QueueDepth depth(String runId);

    QueueDepth depth(String runId, int stepNumber);

    List<WorkItem> deadItems(String runId, int limit);

    /**
     * Moves every dead item of the run back to pending with a fresh attempt budget.
     *
     * @return number of items requeued
     */
    int requeueDead(String runId);

    Optional<WorkItem> find(long itemId);
}
