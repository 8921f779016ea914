package org.smileyface.crawlcore.worker;

import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.frontier.CrawlFrontier;
import org.smileyface.crawlcore.proxy.ProxyPool;
import org.smileyface.crawlcore.queue.WorkQueue;
import org.smileyface.crawlcore.resource.ResourceTracker;

import java.time.Clock;
import java.util.Objects;

/**
 * The shared coordination components a worker talks to. Workers hold no other shared state.
 */
public record WorkerServices(WorkQueue queue,
                             CrawlFrontier frontier,
                             ProxyPool proxies,
                             ResourceTracker resources,
                             CheckpointManager checkpoints,
                             HeartbeatScheduler heartbeats,
                             Clock clock) {

    public WorkerServices {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(frontier, "frontier");
        Objects.requireNonNull(proxies, "proxies");
        Objects.requireNonNull(resources, "resources");
        Objects.requireNonNull(checkpoints, "checkpoints");
        Objects.requireNonNull(heartbeats, "heartbeats");
        Objects.requireNonNull(clock, "clock");
    }
}
