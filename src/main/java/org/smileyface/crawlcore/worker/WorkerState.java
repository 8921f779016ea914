package org.smileyface.crawlcore.worker;

/**
 * Lifecycle state of a CrawlWorker.
 */
public enum WorkerState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}
