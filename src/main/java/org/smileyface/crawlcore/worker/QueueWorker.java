package org.smileyface.crawlcore.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.model.WorkItemStatus;
import org.smileyface.crawlcore.queue.ClaimScope;
import org.smileyface.crawlcore.queue.HeartbeatResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drains the work items of one queue step. Claims of a batch are kept alive by a periodic
 * heartbeat until each item is closed; an item whose claim was lost is skipped.
 */
public class QueueWorker extends CrawlWorker {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    public QueueWorker(String id, StepAssignment assignment, WorkerServices services) {
        super(id, assignment, services);
    }

    @Override
    protected boolean processBatch() throws InterruptedException {
        ClaimScope scope = ClaimScope.step(assignment.runId(), assignment.stepNumber(), assignment.settings().heartbeatExpiry());
        List<WorkItem> batch = services.queue().claimNext(scope, id, assignment.settings().claimBatchSize());
        if (batch.isEmpty()) return false;

        Map<Long, WorkItem> outstanding = new ConcurrentHashMap<>();
        batch.forEach(item -> outstanding.put(item.getItemId(), item));
        Set<Long> lost = ConcurrentHashMap.newKeySet();

        try (HeartbeatScheduler.Handle ignored = services.heartbeats().schedule(
                () -> beat(outstanding, lost), assignment.settings().heartbeatInterval())) {
            for (WorkItem item : batch) {
                if (shouldStop()) {
                    break;
                }
                if (lost.contains(item.getItemId())) {
                    log.warn("Worker {} lost claim on item {} ({}) before processing it", id, item.getItemId(), item.getNaturalKey());
                    outstanding.remove(item.getItemId());
                    continue;
                }
                try {
                    handle(item);
                } finally {
                    outstanding.remove(item.getItemId());
                }
            }
        } finally {
            // stop or fatal failure: everything not yet handled goes back to pending
            for (WorkItem item : outstanding.values()) {
                if (!lost.contains(item.getItemId())) {
                    services.queue().release(item.getItemId(), id);
                }
            }
        }
        return true;
    }

    private void beat(Map<Long, WorkItem> outstanding, Set<Long> lost) {
        for (Long itemId : outstanding.keySet()) {
            if (services.queue().heartbeat(itemId, id) == HeartbeatResult.CLAIM_LOST) {
                lost.add(itemId);
                outstanding.remove(itemId);
            }
        }
    }

    private void handle(WorkItem item) throws InterruptedException {
        FetchTarget target = FetchTarget.item(item.getRunId(), item.getStepNumber(), item.getNaturalKey(), item.getPayload());
        FetchOutcome outcome = fetchWithRetries(target);
        long itemId = item.getItemId();
        String key = item.getNaturalKey();

        if (outcome.isSuccess()) {
            if (services.queue().complete(itemId, id, outcome.getContent())) {
                recordProcessed(key);
            } else {
                log.warn("Worker {} discarded result of item {} ({}): claim no longer held", id, itemId, key);
            }
            return;
        }

        recordFailed(key, outcome.getMessage());
        switch (outcome.getFailure()) {
            case STRUCTURAL -> {
                services.queue().markDead(itemId, id, outcome.getMessage());
                log.warn("Worker {} dead-lettered item {} ({}): {}", id, itemId, key, outcome.getMessage());
            }
            case FATAL -> {
                services.queue().release(itemId, id);
                throw new FatalRunException(assignment.runId(), assignment.stepNumber(),
                        "Fatal failure on item " + key + ": " + outcome.getMessage());
            }
            default -> {
                Optional<WorkItemStatus> status = services.queue().fail(itemId, id, outcome.getFailure() + ": " + outcome.getMessage());
                log.info("Worker {} failed item {} ({}) -> {}: {}", id, itemId, key,
                        status.map(Enum::name).orElse("claim lost"), outcome.getMessage());
            }
        }
    }

    @Override
    protected boolean isDrained() {
        return services.queue().depth(assignment.runId(), assignment.stepNumber()).isDrained();
    }
}
