package org.smileyface.crawlcore.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.FrontierEntry;
import org.smileyface.crawlcore.model.FrontierStatus;

import java.util.List;

/**
 * Drains the crawl frontier of a run. Addresses discovered on a fetched page are added one level
 * deeper with the parent's priority; the frontier rejects duplicates and anything past max depth.
 */
public class FrontierWorker extends CrawlWorker {

    private static final Logger log = LoggerFactory.getLogger(FrontierWorker.class);

    public FrontierWorker(String id, StepAssignment assignment, WorkerServices services) {
        super(id, assignment, services);
    }

    @Override
    protected boolean processBatch() throws InterruptedException {
        List<FrontierEntry> batch = services.frontier().nextBatch(assignment.runId(), assignment.settings().claimBatchSize());
        if (batch.isEmpty()) return false;

        int next = 0;
        try {
            for (; next < batch.size(); next++) {
                if (shouldStop()) break;
                handle(batch.get(next));
            }
        } finally {
            // whatever was handed out but not handled goes back to the queue
            for (int i = next; i < batch.size(); i++) {
                services.frontier().release(batch.get(i));
            }
        }
        return true;
    }

    private void handle(FrontierEntry entry) throws InterruptedException {
        FetchTarget target = FetchTarget.address(assignment.runId(), assignment.stepNumber(), entry.getUrl(), entry.getDepth());
        FetchOutcome outcome = fetchWithRetries(target);

        if (outcome.isSuccess()) {
            services.frontier().markDone(entry, true);
            recordProcessed(entry.getUrl());
            int added = 0;
            for (String url : outcome.getDiscoveredUrls()) {
                if (services.frontier().add(assignment.runId(), url, entry.getPriority(), entry.getDepth() + 1, entry.getUrl())) {
                    added++;
                }
            }
            if (added > 0) {
                log.debug("Worker {} queued {} of {} links found on {}", id, added, outcome.getDiscoveredUrls().size(), entry.getUrl());
            }
            return;
        }

        recordFailed(entry.getUrl(), outcome.getMessage());
        if (outcome.getFailure() == FailureKind.FATAL) {
            // the entry is released by processBatch
            throw new FatalRunException(assignment.runId(), assignment.stepNumber(),
                    "Fatal failure on " + entry.getUrl() + ": " + outcome.getMessage());
        }
        FrontierStatus status = services.frontier().markDone(entry, false);
        log.info("Worker {} failed {} -> {}: {}: {}", id, entry.getUrl(), status, outcome.getFailure(), outcome.getMessage());
    }

    @Override
    protected boolean isDrained() {
        return services.frontier().progress(assignment.runId()).isDrained();
    }
}
