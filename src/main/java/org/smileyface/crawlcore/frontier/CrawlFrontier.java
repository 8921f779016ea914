package org.smileyface.crawlcore.frontier;

import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.FrontierProgress;
import org.smileyface.crawlcore.model.FrontierStatus;

import java.util.List;

/**
 * Deduplicated, prioritized and politeness-aware set of addresses to visit within a run.
 */
public interface CrawlFrontier {

    /**
     * Sets the politeness, retry and depth rules for one run. Runs without a policy use the
     * frontier's default.
     */
    void configure(String runId, FrontierPolicy policy);

    /**
     * Normalizes and fingerprints the url and queues it.
     *
     * @return false when the url is invalid, deeper than the run's max depth, or already known;
     *         each of these is counted as rejected
     */
    boolean add(String runId, String url, int priority, int depth, String referer);

    /**
     * Hands out up to {@code n} eligible entries, highest priority first then discovery order.
     * Entries of a domain still inside its politeness window are skipped, never waited for.
     */
    List<FrontierEntry> nextBatch(String runId, int n);

    /**
     * Closes an in-flight entry: done on success, otherwise re-queued with backoff or, once the
     * retry limit is reached, permanently failed.
     *
     * @return the entry's status afterwards
     */
    FrontierStatus markDone(FrontierEntry entry, boolean success);

    /**
     * Puts an in-flight entry back in the queue without spending a retry, e.g. when its worker
     * stops before fetching it.
     */
    void release(FrontierEntry entry);

    /**
     * Returns every in-flight entry of the run to the queue. Used when a run is resumed and the
     * workers that held those entries are gone.
     *
     * @return number of entries re-queued
     */
    int requeueInFlight(String runId);

    FrontierProgress progress(String runId);

    List<FrontierEntry> failedEntries(String runId, int limit);

    /**
     * @return number of permanently failed entries queued again with a fresh retry budget
     */
    int requeuePermanentlyFailed(String runId);

    /**
     * Drops all state of the run, including its dedup memory.
     */
    void clear(String runId);
}
