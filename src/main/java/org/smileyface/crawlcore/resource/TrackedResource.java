package org.smileyface.crawlcore.resource;

import org.smileyface.crawlcore.model.BrowserInstance;

import java.util.Objects;

/**
 * Try-with-resources scope around one tracked instance. Closing records {@code completed}
 * unless {@link #markAbnormal(String)} was called first.
 */
public final class TrackedResource implements AutoCloseable {

    private final ResourceTracker tracker;
    private final BrowserInstance instance;
    private volatile String abnormalReason;
    private volatile boolean closed;

    TrackedResource(ResourceTracker tracker, BrowserInstance instance) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    public BrowserInstance getInstance() {
        return instance;
    }

    public long getProcessId() {
        return instance.getProcessId();
    }

    public void markAbnormal(String reason) {
        this.abnormalReason = reason == null ? BrowserInstance.REASON_CRASH : reason;
    }

    public boolean isAbnormal() {
        return abnormalReason != null;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        tracker.markTerminated(instance.getInstanceId(), abnormalReason != null ? abnormalReason : BrowserInstance.REASON_COMPLETED);
    }
}
