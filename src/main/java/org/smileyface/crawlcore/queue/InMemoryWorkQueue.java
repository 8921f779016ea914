package org.smileyface.crawlcore.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.model.WorkItemStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-process {@link WorkQueue}. Claims are made exclusive by the instance monitor.
 */
public class InMemoryWorkQueue implements WorkQueue {

    private static final Logger log = LogManager.getLogger();

    static final Comparator<WorkItem> CLAIM_ORDER = Comparator
            .comparingInt(WorkItem::getPriority).reversed()
            .thenComparing(WorkItem::getEnqueuedAt)
            .thenComparingLong(WorkItem::getItemId);

    private final Clock clock;
    private final int defaultMaxAttempts;
    private final Duration defaultHeartbeatExpiry;

    private final Map<Long, WorkItem> items = new LinkedHashMap<>();
    private final Map<String, Long> keys = new HashMap<>();
    private long nextId = 1;

    public InMemoryWorkQueue(Clock clock, int defaultMaxAttempts, Duration defaultHeartbeatExpiry) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultHeartbeatExpiry = Objects.requireNonNull(defaultHeartbeatExpiry, "defaultHeartbeatExpiry");
    }

    @Override
    public boolean enqueue(String runId, String naturalKey, byte[] payload, int priority) {
        return enqueue(new WorkItemRequest(runId, 0, naturalKey, payload, priority, defaultMaxAttempts));
    }

    @Override
    public synchronized boolean enqueue(WorkItemRequest request) {
        String key = request.runId() + '\u0000' + request.naturalKey();
        if (keys.containsKey(key)) {
            log.debug("Duplicate natural key {} ignored for run {}", request.naturalKey(), request.runId());
            return false;
        }
        WorkItem item = new WorkItem();
        item.setItemId(nextId++);
        item.setRunId(request.runId());
        item.setStepNumber(request.stepNumber());
        item.setNaturalKey(request.naturalKey());
        item.setPayload(request.payload() == null ? null : request.payload().clone());
        item.setPriority(request.priority());
        item.setMaxAttempts(request.maxAttempts());
        item.setStatus(WorkItemStatus.PENDING);
        item.setEnqueuedAt(clock.instant());
        items.put(item.getItemId(), item);
        keys.put(key, item.getItemId());
        return true;
    }

    @Override
    public List<WorkItem> claimNext(String workerId, int batchSize) {
        return claimNext(ClaimScope.anyRun(defaultHeartbeatExpiry), workerId, batchSize);
    }

    @Override
    public synchronized List<WorkItem> claimNext(ClaimScope scope, String workerId, int batchSize) {
        Objects.requireNonNull(scope, "scope");
        requireWorker(workerId);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(scope.heartbeatExpiry());

        List<WorkItem> candidates = new ArrayList<>();
        for (WorkItem item : items.values()) {
            if (!scope.matches(item.getRunId(), item.getStepNumber())) continue;
            boolean stale = item.getStatus() == WorkItemStatus.CLAIMED && item.getHeartbeatAt().isBefore(cutoff);
            if (stale && item.getAttemptCount() >= item.getMaxAttempts()) {
                deadLetter(item, "claim expired after final attempt (worker " + item.getClaimedBy() + ")", now);
                continue;
            }
            boolean open = item.getStatus() == WorkItemStatus.PENDING || item.getStatus() == WorkItemStatus.FAILED;
            if ((open || stale) && item.getAttemptCount() < item.getMaxAttempts()) {
                candidates.add(item);
            }
        }
        candidates.sort(CLAIM_ORDER);

        List<WorkItem> claimed = new ArrayList<>(Math.min(batchSize, candidates.size()));
        for (WorkItem item : candidates) {
            if (claimed.size() >= batchSize) break;
            if (item.getStatus() == WorkItemStatus.CLAIMED) {
                log.info("Reclaiming item {} from {} (last heartbeat {})", item.getItemId(), item.getClaimedBy(), item.getHeartbeatAt());
            }
            item.setStatus(WorkItemStatus.CLAIMED);
            item.setClaimedBy(workerId);
            item.setClaimedAt(now);
            item.setHeartbeatAt(now);
            item.setAttemptCount(item.getAttemptCount() + 1);
            claimed.add(new WorkItem(item));
        }
        return claimed;
    }

    @Override
    public synchronized HeartbeatResult heartbeat(long itemId, String workerId) {
        WorkItem item = held(itemId, workerId);
        if (item == null) {
            return HeartbeatResult.CLAIM_LOST;
        }
        item.setHeartbeatAt(clock.instant());
        return HeartbeatResult.RENEWED;
    }

    @Override
    public synchronized boolean complete(long itemId, String workerId, byte[] result) {
        WorkItem item = held(itemId, workerId);
        if (item == null) {
            log.warn("Complete of item {} by {} ignored: claim lost", itemId, workerId);
            return false;
        }
        item.setStatus(WorkItemStatus.COMPLETED);
        item.setResult(result == null ? null : result.clone());
        item.setCompletedAt(clock.instant());
        return true;
    }

    @Override
    public synchronized Optional<WorkItemStatus> fail(long itemId, String workerId, String error) {
        WorkItem item = held(itemId, workerId);
        if (item == null) {
            log.warn("Fail of item {} by {} ignored: claim lost", itemId, workerId);
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (item.getAttemptCount() >= item.getMaxAttempts()) {
            deadLetter(item, error, now);
        } else {
            item.setStatus(WorkItemStatus.FAILED);
            item.setLastError(error);
            item.setClaimedBy(null);
            item.setHeartbeatAt(null);
        }
        return Optional.of(item.getStatus());
    }

    @Override
    public synchronized boolean markDead(long itemId, String workerId, String error) {
        WorkItem item = held(itemId, workerId);
        if (item == null) {
            return false;
        }
        deadLetter(item, error, clock.instant());
        return true;
    }

    @Override
    public synchronized boolean release(long itemId, String workerId) {
        WorkItem item = held(itemId, workerId);
        if (item == null) {
            return false;
        }
        item.setStatus(WorkItemStatus.PENDING);
        item.setClaimedBy(null);
        item.setClaimedAt(null);
        item.setHeartbeatAt(null);
        item.setAttemptCount(Math.max(0, item.getAttemptCount() - 1));
        return true;
    }

    @Override
    public synchronized QueueDepth depth(String runId) {
        return count(runId, null);
    }

    @Override
    public synchronized QueueDepth depth(String runId, int stepNumber) {
        return count(runId, stepNumber);
    }

    private QueueDepth count(String runId, Integer stepNumber) {
        long pending = 0, claimed = 0, completed = 0, failed = 0, dead = 0;
        for (WorkItem item : items.values()) {
            if (!item.getRunId().equals(runId)) continue;
            if (stepNumber != null && item.getStepNumber() != stepNumber) continue;
            switch (item.getStatus()) {
                case PENDING -> pending++;
                case CLAIMED -> claimed++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case DEAD -> dead++;
            }
        }
        return new QueueDepth(pending, claimed, completed, failed, dead);
    }

    @Override
    public synchronized List<WorkItem> deadItems(String runId, int limit) {
        return items.values().stream()
                .filter(i -> i.getRunId().equals(runId) && i.getStatus() == WorkItemStatus.DEAD)
                .sorted(Comparator.comparing(WorkItem::getCompletedAt).reversed())
                .limit(Math.max(0, limit))
                .map(WorkItem::new)
                .toList();
    }

    @Override
    public synchronized int requeueDead(String runId) {
        int n = 0;
        for (WorkItem item : items.values()) {
            if (item.getRunId().equals(runId) && item.getStatus() == WorkItemStatus.DEAD) {
                item.setStatus(WorkItemStatus.PENDING);
                item.setAttemptCount(0);
                item.setClaimedBy(null);
                item.setClaimedAt(null);
                item.setHeartbeatAt(null);
                item.setCompletedAt(null);
                n++;
            }
        }
        if (n > 0) {
            log.info("Requeued {} dead items of run {}", n, runId);
        }
        return n;
    }

    @Override
    public synchronized Optional<WorkItem> find(long itemId) {
        WorkItem item = items.get(itemId);
        return item == null ? Optional.empty() : Optional.of(new WorkItem(item));
    }

    private WorkItem held(long itemId, String workerId) {
        WorkItem item = items.get(itemId);
        if (item == null || item.getStatus() != WorkItemStatus.CLAIMED || !Objects.equals(item.getClaimedBy(), workerId)) {
            return null;
        }
        return item;
    }

    private void deadLetter(WorkItem item, String error, Instant now) {
        item.setStatus(WorkItemStatus.DEAD);
        item.setLastError(error);
        item.setClaimedBy(null);
        item.setHeartbeatAt(null);
        item.setCompletedAt(now);
        log.warn("Item {} ({}) of run {} dead-lettered after {} attempts: {}",
                item.getItemId(), item.getNaturalKey(), item.getRunId(), item.getAttemptCount(), error);
    }

    private static void requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }
}
