package org.smileyface.crawlcore.frontier;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-run frontier tunables, resolved from fleet settings.
 *
 * @param politenessDelay minimum gap between two hand-outs for the same domain
 * @param backoff         retry delay for failed entries
 * @param retryLimit      failures after which an entry is permanently failed
 * @param maxDepth        deepest link depth accepted by {@code add}
 */
public record FrontierPolicy(Duration politenessDelay, BackoffPolicy backoff, int retryLimit, int maxDepth) {

    public FrontierPolicy {
        Objects.requireNonNull(politenessDelay, "politenessDelay");
        Objects.requireNonNull(backoff, "backoff");
        if (politenessDelay.isNegative()) {
            throw new IllegalArgumentException("politenessDelay must not be negative");
        }
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be >= 1, was " + retryLimit);
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, was " + maxDepth);
        }
    }
}
