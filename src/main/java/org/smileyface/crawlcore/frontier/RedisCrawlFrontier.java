package org.smileyface.crawlcore.frontier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.FrontierProgress;
import org.smileyface.crawlcore.model.FrontierStatus;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis-backed distributed implementation of {@link CrawlFrontier}. Keys of a run live under
 * {@code {ns}:{runId}}:
 * <ul>
 *   <li>{@code :entries} hash fingerprint to entry JSON; {@code HSETNX} is the dedup check</li>
 *   <li>{@code :queue} sorted set of handable fingerprints, scored by priority then sequence</li>
 *   <li>{@code :delayed} sorted set of backing-off fingerprints, scored by eligibility time</li>
 *   <li>{@code :failed} sorted set of permanently failed fingerprints</li>
 *   <li>{@code :inflight} set of handed-out fingerprints</li>
 *   <li>{@code :domain:{host}} politeness gate, {@code SET NX PX delay}; the hosts are kept in {@code :domains}</li>
 *   <li>{@code :seq}, {@code :rejected} and the {@code :stats} hash of done/failed counters</li>
 * </ul>
 * Removing a fingerprint from {@code :queue} is what hands an entry to exactly one caller, and
 * removing it from {@code :inflight} is what lets exactly one caller move it out of flight.
 */
public class RedisCrawlFrontier implements CrawlFrontier {

    private static final Logger log = LoggerFactory.getLogger(RedisCrawlFrontier.class);

    // priority dominates the score, the discovery sequence breaks ties
    private static final double PRIORITY_WEIGHT = 1e10;

    private static final String STAT_DONE = "done";
    private static final String STAT_PERMANENTLY_FAILED = "permanently_failed";

    private static final List<String> RUN_KEYS =
            List.of("entries", "queue", "delayed", "failed", "inflight", "domains", "seq", "rejected", "stats");

    private final StringRedisTemplate redis;
    private final Clock clock;
    private final String namespace;
    private final FrontierPolicy defaultPolicy;
    private final int scanLimit;
    private final ObjectMapper mapper;
    private final Map<String, FrontierPolicy> policies = new ConcurrentHashMap<>();

    public RedisCrawlFrontier(StringRedisTemplate redis, Clock clock, String namespace,
                              FrontierPolicy defaultPolicy, int scanLimit) {
        this.redis = Objects.requireNonNull(redis, "redis");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.namespace = (namespace == null || namespace.isBlank()) ? "frontier" : namespace;
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.scanLimit = Math.max(1, scanLimit);
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void configure(String runId, FrontierPolicy policy) {
        policies.put(runId, Objects.requireNonNull(policy, "policy"));
    }

    private FrontierPolicy policy(String runId) {
        return policies.getOrDefault(runId, defaultPolicy);
    }

    @Override
    public boolean add(String runId, String url, int priority, int depth, String referer) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null || depth < 0 || depth > policy(runId).maxDepth()) {
            redis.opsForValue().increment(key(runId, "rejected"));
            log.debug("Rejected {} (depth {}) for run {}", url, depth, runId);
            return false;
        }
        String fp = UrlNormalizer.fingerprint(normalized);
        Long seq = redis.opsForValue().increment(key(runId, "seq"));

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
        e.setSequence(seq == null ? 0L : seq);

        Boolean added = redis.opsForHash().putIfAbsent(key(runId, "entries"), fp, write(e));
        if (!Boolean.TRUE.equals(added)) {
            redis.opsForValue().increment(key(runId, "rejected"));
            return false;
        }
        redis.opsForZSet().add(key(runId, "queue"), fp, score(e));
        return true;
    }

    @Override
    public List<FrontierEntry> nextBatch(String runId, int n) {
        if (n < 1) return List.of();
        promoteDue(runId);
        FrontierPolicy policy = policy(runId);
        String queueKey = key(runId, "queue");
        Set<String> candidates = redis.opsForZSet().range(queueKey, 0, scanLimit - 1);
        if (candidates == null || candidates.isEmpty()) return List.of();

        List<FrontierEntry> batch = new ArrayList<>(n);
        Set<String> throttled = new HashSet<>();
        for (String fp : candidates) {
            if (batch.size() >= n) break;
            FrontierEntry e = read(runId, fp);
            if (e == null || throttled.contains(e.getDomain())) continue;

            String gate = key(runId, "domain:" + e.getDomain());
            boolean gated = !policy.politenessDelay().isZero();
            if (gated) {
                if (!Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(gate, "1", policy.politenessDelay()))) {
                    throttled.add(e.getDomain());
                    continue;
                }
                redis.opsForSet().add(key(runId, "domains"), e.getDomain());
            }
            Long removed = redis.opsForZSet().remove(queueKey, fp);
            if (removed == null || removed == 0) {
                // another worker took it between range and remove
                if (gated) redis.delete(gate);
                continue;
            }
            e.setStatus(FrontierStatus.IN_FLIGHT);
            e.setNextEligibleAt(null);
            redis.opsForSet().add(key(runId, "inflight"), fp);
            save(e);
            batch.add(e);
            if (gated) throttled.add(e.getDomain());
        }
        return batch;
    }

    private void promoteDue(String runId) {
        String delayedKey = key(runId, "delayed");
        Set<String> due = redis.opsForZSet().rangeByScore(delayedKey, Double.NEGATIVE_INFINITY, clock.millis());
        if (due == null) return;
        for (String fp : due) {
            Long removed = redis.opsForZSet().remove(delayedKey, fp);
            if (removed == null || removed == 0) continue;
            FrontierEntry e = read(runId, fp);
            if (e != null) {
                redis.opsForZSet().add(key(runId, "queue"), fp, score(e));
            }
        }
    }

    @Override
    public FrontierStatus markDone(FrontierEntry entry, boolean success) {
        String runId = entry.getRunId();
        FrontierEntry e = read(runId, entry.getUrlFingerprint());
        if (e == null) {
            throw new IllegalArgumentException("Unknown frontier entry " + entry.getUrl() + " in run " + runId);
        }
        if (!leaveFlight(runId, e.getUrlFingerprint())) {
            FrontierEntry current = read(runId, e.getUrlFingerprint());
            FrontierStatus status = current == null ? e.getStatus() : current.getStatus();
            log.warn("markDone ignored for {} in run {}: entry is {}", e.getUrl(), runId, status);
            return status;
        }
        if (success) {
            e.setStatus(FrontierStatus.DONE);
            save(e);
            redis.opsForHash().increment(key(runId, "stats"), STAT_DONE, 1);
            return e.getStatus();
        }
        FrontierPolicy policy = policy(runId);
        e.setRetryCount(e.getRetryCount() + 1);
        Instant now = clock.instant();
        if (e.getRetryCount() >= policy.retryLimit()) {
            e.setStatus(FrontierStatus.PERMANENTLY_FAILED);
            save(e);
            redis.opsForHash().increment(key(runId, "stats"), STAT_PERMANENTLY_FAILED, 1);
            redis.opsForZSet().add(key(runId, "failed"), e.getUrlFingerprint(), now.toEpochMilli());
            log.warn("Frontier entry {} of run {} permanently failed after {} attempts", e.getUrl(), runId, e.getRetryCount());
        } else {
            Instant eligible = now.plus(policy.backoff().delay(e.getRetryCount()));
            e.setStatus(FrontierStatus.FAILED);
            e.setNextEligibleAt(eligible);
            save(e);
            redis.opsForZSet().add(key(runId, "delayed"), e.getUrlFingerprint(), eligible.toEpochMilli());
        }
        return e.getStatus();
    }

    @Override
    public void release(FrontierEntry entry) {
        if (!leaveFlight(entry.getRunId(), entry.getUrlFingerprint())) return;
        FrontierEntry e = read(entry.getRunId(), entry.getUrlFingerprint());
        if (e != null) requeue(e);
    }

    @Override
    public int requeueInFlight(String runId) {
        Set<String> inFlight = redis.opsForSet().members(key(runId, "inflight"));
        if (inFlight == null) return 0;
        int n = 0;
        for (String fp : inFlight) {
            if (!leaveFlight(runId, fp)) continue;
            FrontierEntry e = read(runId, fp);
            if (e != null) {
                requeue(e);
                n++;
            }
        }
        if (n > 0) log.info("Re-queued {} in-flight frontier entries of run {}", n, runId);
        return n;
    }

    /**
     * True for the one caller that takes the entry out of flight.
     */
    private boolean leaveFlight(String runId, String fp) {
        Long removed = redis.opsForSet().remove(key(runId, "inflight"), fp);
        return removed != null && removed > 0;
    }

    private void requeue(FrontierEntry e) {
        e.setStatus(FrontierStatus.QUEUED);
        save(e);
        redis.opsForZSet().add(key(e.getRunId(), "queue"), e.getUrlFingerprint(), score(e));
    }

    @Override
    public FrontierProgress progress(String runId) {
        Long total = redis.opsForHash().size(key(runId, "entries"));
        long done = stat(runId, STAT_DONE);
        long failed = stat(runId, STAT_PERMANENTLY_FAILED);
        long all = total == null ? 0 : total;
        return new FrontierProgress(done, failed, Math.max(0, all - done - failed), all, longValue(redis.opsForValue().get(key(runId, "rejected"))));
    }

    @Override
    public List<FrontierEntry> failedEntries(String runId, int limit) {
        if (limit < 1) return List.of();
        Set<String> fps = redis.opsForZSet().reverseRange(key(runId, "failed"), 0, limit - 1);
        if (fps == null) return List.of();
        List<FrontierEntry> out = new ArrayList<>(fps.size());
        for (String fp : fps) {
            FrontierEntry e = read(runId, fp);
            if (e != null) out.add(e);
        }
        return out;
    }

    @Override
    public int requeuePermanentlyFailed(String runId) {
        String failedKey = key(runId, "failed");
        Set<String> fps = redis.opsForZSet().range(failedKey, 0, -1);
        if (fps == null) return 0;
        int n = 0;
        for (String fp : fps) {
            Long removed = redis.opsForZSet().remove(failedKey, fp);
            if (removed == null || removed == 0) continue;
            FrontierEntry e = read(runId, fp);
            if (e == null) continue;
            e.setStatus(FrontierStatus.QUEUED);
            e.setRetryCount(0);
            e.setNextEligibleAt(null);
            save(e);
            redis.opsForHash().increment(key(runId, "stats"), STAT_PERMANENTLY_FAILED, -1);
            redis.opsForZSet().add(key(runId, "queue"), fp, score(e));
            n++;
        }
        return n;
    }

    @Override
    public void clear(String runId) {
        List<String> keys = new ArrayList<>();
        Set<String> domains = redis.opsForSet().members(key(runId, "domains"));
        if (domains != null) {
            for (String domain : domains) {
                keys.add(key(runId, "domain:" + domain));
            }
        }
        for (String suffix : RUN_KEYS) {
            keys.add(key(runId, suffix));
        }
        redis.delete(keys);
        policies.remove(runId);
    }

    private long stat(String runId, String field) {
        Object v = redis.opsForHash().get(key(runId, "stats"), field);
        return v == null ? 0L : longValue(v.toString());
    }

    private static long longValue(String s) {
        return s == null ? 0L : Long.parseLong(s);
    }

    private static double score(FrontierEntry e) {
        return -e.getPriority() * PRIORITY_WEIGHT + e.getSequence();
    }

    private String key(String runId, String suffix) {
        return namespace + ":" + runId + ":" + suffix;
    }

    private FrontierEntry read(String runId, String fp) {
        Object json = redis.opsForHash().get(key(runId, "entries"), fp);
        if (json == null) return null;
        try {
            return mapper.readValue(json.toString(), FrontierEntry.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt frontier entry " + fp + " in run " + runId, ex);
        }
    }

    private void save(FrontierEntry e) {
        redis.opsForHash().put(key(e.getRunId(), "entries"), e.getUrlFingerprint(), write(e));
    }

    private String write(FrontierEntry e) {
        try {
            return mapper.writeValueAsString(e);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize frontier entry " + e.getUrl(), ex);
        }
    }
}
