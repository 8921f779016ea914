package org.smileyface.crawlcore.queue;

public enum HeartbeatResult {
    /** The caller still holds the claim and its expiry was pushed out. */
    RENEWED,
    /** The item was reclaimed, finished or never held by the caller; stop working on it. */
    CLAIM_LOST
}
