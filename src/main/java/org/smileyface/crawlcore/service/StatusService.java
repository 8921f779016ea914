package org.smileyface.crawlcore.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.checkpoint.RunNotFoundException;
import org.smileyface.crawlcore.frontier.CrawlFrontier;
import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.pipeline.PipelineRunner;
import org.smileyface.crawlcore.proxy.ProxyPool;
import org.smileyface.crawlcore.queue.WorkQueue;
import org.smileyface.crawlcore.resource.ResourceTracker;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only views over runs, backlogs and pools, plus the manual triage operations
 * (re-queueing dead-lettered and permanently failed work).
 */
@Service
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    static final int MAX_LIMIT = 1000;

    private final CheckpointManager checkpoints;
    private final WorkQueue queue;
    private final CrawlFrontier frontier;
    private final ProxyPool proxies;
    private final ResourceTracker resources;
    private final PipelineRunner runner;

    public StatusService(CheckpointManager checkpoints, WorkQueue queue, CrawlFrontier frontier,
                         ProxyPool proxies, ResourceTracker resources, PipelineRunner runner) {
        this.checkpoints = checkpoints;
        this.queue = queue;
        this.frontier = frontier;
        this.proxies = proxies;
        this.resources = resources;
        this.runner = runner;
    }

    public List<Run> runs(String fleetName, int limit) {
        return checkpoints.listRuns(blankToNull(fleetName), clamp(limit));
    }

    /**
     * @throws RunNotFoundException for an unknown run
     */
    public RunDetail run(String runId) {
        Run run = requireRun(runId);
        return new RunDetail(run,
                checkpoints.steps(runId),
                queue.depth(runId),
                frontier.progress(runId),
                runner.isDriving(runId),
                runner.workerStatuses(runId));
    }

    public List<WorkItem> deadItems(String runId, int limit) {
        requireRun(runId);
        return queue.deadItems(runId, clamp(limit));
    }

    public List<FrontierEntry> failedEntries(String runId, int limit) {
        requireRun(runId);
        return frontier.failedEntries(runId, clamp(limit));
    }

    public int requeueDead(String runId) {
        requireRun(runId);
        int n = queue.requeueDead(runId);
        log.info("Re-queued {} dead items of run {}", n, runId);
        return n;
    }

    public int requeueFailedEntries(String runId) {
        requireRun(runId);
        int n = frontier.requeuePermanentlyFailed(runId);
        log.info("Re-queued {} permanently failed frontier entries of run {}", n, runId);
        return n;
    }

    public ProxyPoolHealth proxyHealth() {
        return proxies.healthSummary();
    }

    public List<BrowserInstance> activeResources(String runId) {
        return resources.activeInstances(blankToNull(runId));
    }

    private Run requireRun(String runId) {
        return checkpoints.run(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private static int clamp(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, was " + limit);
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
