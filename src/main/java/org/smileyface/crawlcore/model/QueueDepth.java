package org.smileyface.crawlcore.model;

/**
 * Work queue counts by status for a run (or one step of it).
 */
public record QueueDepth(long pending, long claimed, long completed, long failed, long dead) {

    public static final QueueDepth EMPTY = new QueueDepth(0, 0, 0, 0, 0);

    public long total() {
        return pending + claimed + completed + failed + dead;
    }

    /**
     * Items that still need a worker: never claimed, held, or waiting for a retry.
     */
    public long remaining() {
        return pending + claimed + failed;
    }

    public boolean isDrained() {
        return remaining() == 0;
    }
}
