package org.smileyface.crawlcore.model;

/**
 * Frontier counters for one run. {@code rejected} counts duplicate, invalid or too-deep adds.
 */
public record FrontierProgress(long completed, long failed, long remaining, long total, long rejected) {

    public static final FrontierProgress EMPTY = new FrontierProgress(0, 0, 0, 0, 0);

    public boolean isDrained() {
        return remaining == 0;
    }
}
