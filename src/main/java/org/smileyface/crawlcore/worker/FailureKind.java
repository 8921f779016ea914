package org.smileyface.crawlcore.worker;

/**
 * Classification of a failed fetch, deciding how the item is retried or given up.
 */
public enum FailureKind {
    /** Timeout or connection reset; retried locally with backoff. */
    TRANSIENT,
    /** Refused by the target (rate limited, captcha, 403); retried locally on another endpoint. */
    BLOCKED,
    /** The target exists but its content cannot be processed; the item is dead-lettered. */
    STRUCTURAL,
    /** The browser/rendering process died; it is replaced and the attempt fails. */
    RESOURCE,
    /** Unrecoverable for the whole run; the run halts at the current step. */
    FATAL
}
