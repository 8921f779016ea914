package org.smileyface.crawlcore.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.BrowserInstance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-process {@link ResourceTracker}.
 */
public class InMemoryResourceTracker implements ResourceTracker {

    private static final Logger log = LogManager.getLogger();

    private final Clock clock;
    private final Map<Long, BrowserInstance> instances = new LinkedHashMap<>();
    private long nextId = 1;

    public InMemoryResourceTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized BrowserInstance register(String runId, int stepNumber, long threadId, long processId, Long parentProcessId) {
        BrowserInstance b = new BrowserInstance();
        b.setInstanceId(nextId++);
        b.setRunId(runId);
        b.setStepNumber(stepNumber);
        b.setThreadId(threadId);
        b.setProcessId(processId);
        b.setParentProcessId(parentProcessId);
        b.setStartedAt(clock.instant());
        instances.put(b.getInstanceId(), b);
        log.debug("Browser instance {} registered (pid={}, run={}, step={})", b.getInstanceId(), processId, runId, stepNumber);
        return new BrowserInstance(b);
    }

    @Override
    public synchronized boolean markTerminated(long instanceId, String reason) {
        BrowserInstance b = instances.get(instanceId);
        if (b == null || !b.isActive()) {
            return false;
        }
        terminate(b, reason, clock.instant());
        return true;
    }

    @Override
    public synchronized int markTerminatedByProcessId(long processId, String reason) {
        Instant now = clock.instant();
        int n = 0;
        for (BrowserInstance b : instances.values()) {
            if (b.isActive() && b.getProcessId() == processId) {
                terminate(b, reason, now);
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized List<BrowserInstance> sweepOrphans(Duration maxAge) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(maxAge);
        List<BrowserInstance> swept = new ArrayList<>();
        for (BrowserInstance b : instances.values()) {
            if (b.isActive() && b.getStartedAt().isBefore(cutoff)) {
                terminate(b, BrowserInstance.REASON_ORPHAN_CLEANUP, now);
                swept.add(new BrowserInstance(b));
            }
        }
        if (!swept.isEmpty()) {
            log.warn("Swept {} orphaned browser instances older than {}", swept.size(), maxAge);
        }
        return swept;
    }

    @Override
    public synchronized List<BrowserInstance> activeInstances(String runId) {
        return instances.values().stream()
                .filter(BrowserInstance::isActive)
                .filter(b -> runId == null || runId.equals(b.getRunId()))
                .map(BrowserInstance::new)
                .toList();
    }

    @Override
    public synchronized long activeCount() {
        return instances.values().stream().filter(BrowserInstance::isActive).count();
    }

    private static void terminate(BrowserInstance b, String reason, Instant now) {
        b.setTerminatedAt(now);
        b.setTerminationReason(reason);
        log.debug("Browser instance {} (pid={}) terminated: {}", b.getInstanceId(), b.getProcessId(), reason);
    }
}
