package org.smileyface.crawlcore.frontier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.FrontierProgress;
import org.smileyface.crawlcore.model.FrontierStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link CrawlFrontier}; all state of a run is guarded by the frontier monitor.
 */
public class InMemoryCrawlFrontier implements CrawlFrontier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCrawlFrontier.class);

    static final Comparator<FrontierEntry> HAND_OUT_ORDER = Comparator
            .comparingInt(FrontierEntry::getPriority).reversed()
            .thenComparingLong(FrontierEntry::getSequence);

    private final Clock clock;
    private final FrontierPolicy defaultPolicy;
    private final Map<String, FrontierPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, RunFrontier> runs = new HashMap<>();

    public InMemoryCrawlFrontier(Clock clock, FrontierPolicy defaultPolicy) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
    }

    @Override
    public void configure(String runId, FrontierPolicy policy) {
        policies.put(runId, Objects.requireNonNull(policy, "policy"));
    }

    private FrontierPolicy policy(String runId) {
        return policies.getOrDefault(runId, defaultPolicy);
    }

    @Override
    public synchronized boolean add(String runId, String url, int priority, int depth, String referer) {
        RunFrontier rf = runs.computeIfAbsent(runId, k -> new RunFrontier());
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            rf.rejected++;
            log.debug("Rejected invalid url {} for run {}", url, runId);
            return false;
        }
        if (depth < 0 || depth > policy(runId).maxDepth()) {
            rf.rejected++;
            log.debug("Rejected {} at depth {} for run {}", normalized, depth, runId);
            return false;
        }
        String fp = UrlNormalizer.fingerprint(normalized);
        if (rf.entries.containsKey(fp)) {
            rf.rejected++;
            return false;
        }
        FrontierEntry e = new FrontierEntry();
        e.setRunId(runId);
        e.setUrlFingerprint(fp);
        e.setUrl(normalized);
        e.setDomain(UrlNormalizer.domainOf(normalized));
        e.setPriority(priority);
        e.setDepth(depth);
        e.setReferer(referer);
        e.setStatus(FrontierStatus.QUEUED);
        e.setDiscoveredAt(clock.instant());
        e.setSequence(rf.nextSequence++);
        rf.entries.put(fp, e);
        return true;
    }

    @Override
    public synchronized List<FrontierEntry> nextBatch(String runId, int n) {
        RunFrontier rf = runs.get(runId);
        if (rf == null || n < 1) return List.of();
        Instant now = clock.instant();
        FrontierPolicy policy = policy(runId);

        List<FrontierEntry> eligible = new ArrayList<>();
        for (FrontierEntry e : rf.entries.values()) {
            boolean waiting = e.getStatus() == FrontierStatus.QUEUED || e.getStatus() == FrontierStatus.FAILED;
            if (waiting && (e.getNextEligibleAt() == null || !e.getNextEligibleAt().isAfter(now))) {
                eligible.add(e);
            }
        }
        eligible.sort(HAND_OUT_ORDER);

        List<FrontierEntry> batch = new ArrayList<>(Math.min(n, eligible.size()));
        for (FrontierEntry e : eligible) {
            if (batch.size() >= n) break;
            Instant domainReady = rf.domainNextEligible.get(e.getDomain());
            if (domainReady != null && domainReady.isAfter(now)) {
                continue;
            }
            rf.domainNextEligible.put(e.getDomain(), now.plus(policy.politenessDelay()));
            e.setStatus(FrontierStatus.IN_FLIGHT);
            batch.add(new FrontierEntry(e));
        }
        return batch;
    }

    @Override
    public synchronized FrontierStatus markDone(FrontierEntry entry, boolean success) {
        RunFrontier rf = runs.get(entry.getRunId());
        FrontierEntry e = rf == null ? null : rf.entries.get(entry.getUrlFingerprint());
        if (e == null) {
            throw new IllegalArgumentException("Unknown frontier entry " + entry.getUrl() + " in run " + entry.getRunId());
        }
        if (e.getStatus() != FrontierStatus.IN_FLIGHT) {
            log.warn("markDone ignored for {} in run {}: entry is {}", e.getUrl(), e.getRunId(), e.getStatus());
            return e.getStatus();
        }
        if (success) {
            e.setStatus(FrontierStatus.DONE);
            return e.getStatus();
        }
        FrontierPolicy policy = policy(e.getRunId());
        e.setRetryCount(e.getRetryCount() + 1);
        if (e.getRetryCount() >= policy.retryLimit()) {
            e.setStatus(FrontierStatus.PERMANENTLY_FAILED);
            e.setNextEligibleAt(null);
            log.warn("Frontier entry {} of run {} permanently failed after {} attempts", e.getUrl(), e.getRunId(), e.getRetryCount());
        } else {
            e.setStatus(FrontierStatus.FAILED);
            e.setNextEligibleAt(clock.instant().plus(policy.backoff().delay(e.getRetryCount())));
        }
        return e.getStatus();
    }

    @Override
    public synchronized void release(FrontierEntry entry) {
        RunFrontier rf = runs.get(entry.getRunId());
        FrontierEntry e = rf == null ? null : rf.entries.get(entry.getUrlFingerprint());
        if (e != null && e.getStatus() == FrontierStatus.IN_FLIGHT) {
            e.setStatus(FrontierStatus.QUEUED);
        }
    }

    @Override
    public synchronized int requeueInFlight(String runId) {
        RunFrontier rf = runs.get(runId);
        if (rf == null) return 0;
        int n = 0;
        for (FrontierEntry e : rf.entries.values()) {
            if (e.getStatus() == FrontierStatus.IN_FLIGHT) {
                e.setStatus(FrontierStatus.QUEUED);
                n++;
            }
        }
        if (n > 0) log.info("Re-queued {} in-flight frontier entries of run {}", n, runId);
        return n;
    }

    @Override
    public synchronized FrontierProgress progress(String runId) {
        RunFrontier rf = runs.get(runId);
        if (rf == null) return FrontierProgress.EMPTY;
        long completed = 0, failed = 0, remaining = 0;
        for (FrontierEntry e : rf.entries.values()) {
            switch (e.getStatus()) {
                case DONE -> completed++;
                case PERMANENTLY_FAILED -> failed++;
                default -> remaining++;
            }
        }
        return new FrontierProgress(completed, failed, remaining, rf.entries.size(), rf.rejected);
    }

    @Override
    public synchronized List<FrontierEntry> failedEntries(String runId, int limit) {
        RunFrontier rf = runs.get(runId);
        if (rf == null) return List.of();
        return rf.entries.values().stream()
                .filter(e -> e.getStatus() == FrontierStatus.PERMANENTLY_FAILED)
                .limit(Math.max(0, limit))
                .map(FrontierEntry::new)
                .toList();
    }

    @Override
    public synchronized int requeuePermanentlyFailed(String runId) {
        RunFrontier rf = runs.get(runId);
        if (rf == null) return 0;
        int n = 0;
        for (FrontierEntry e : rf.entries.values()) {
            if (e.getStatus() == FrontierStatus.PERMANENTLY_FAILED) {
                e.setStatus(FrontierStatus.QUEUED);
                e.setRetryCount(0);
                e.setNextEligibleAt(null);
                n++;
            }
        }
        return n;
    }

    @Override
    public synchronized void clear(String runId) {
        runs.remove(runId);
        policies.remove(runId);
    }

    private static final class RunFrontier {
        private final Map<String, FrontierEntry> entries = new LinkedHashMap<>();
        private final Map<String, Instant> domainNextEligible = new HashMap<>();
        private long nextSequence;
        private long rejected;
    }
}
