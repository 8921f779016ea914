package org.smileyface.crawlcore.resource;

import org.smileyface.crawlcore.model.BrowserInstance;

import java.time.Duration;
import java.util.List;

/**
 * Bookkeeping for spawned browser/rendering processes so that none outlives its owner unnoticed.
 */
public interface ResourceTracker {

    BrowserInstance register(String runId, int stepNumber, long threadId, long processId, Long parentProcessId);

    /**
     * Closes the record. Only the first termination of an instance is recorded.
     *
     * @return false when the instance is unknown or already terminated
     */
    boolean markTerminated(long instanceId, String reason);

    /**
     * @return number of active records of that process that were closed
     */
    int markTerminatedByProcessId(long processId, String reason);

    /**
     * Closes every active record older than {@code maxAge} with reason {@code orphan_cleanup}.
     *
     * @return the swept instances, so their processes can be killed
     */
    List<BrowserInstance> sweepOrphans(Duration maxAge);

    /** Active instances of the run, or of every run when {@code runId} is null. */
    List<BrowserInstance> activeInstances(String runId);

    long activeCount();

    /**
     * Registers the instance and returns a scope that closes it on {@code close()}.
     */
    default TrackedResource track(String runId, int stepNumber, long processId, Long parentProcessId) {
        BrowserInstance instance = register(runId, stepNumber, Thread.currentThread().getId(), processId, parentProcessId);
        return new TrackedResource(this, instance);
    }
}
