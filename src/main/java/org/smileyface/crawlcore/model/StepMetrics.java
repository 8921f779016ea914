package org.smileyface.crawlcore.model;

/**
 * Row counters reported for a step.
 */
public record StepMetrics(long read, long processed, long inserted, long updated, long rejected) {

    public static final StepMetrics EMPTY = new StepMetrics(0, 0, 0, 0, 0);

    public StepMetrics {
        if (read < 0 || processed < 0 || inserted < 0 || updated < 0 || rejected < 0) {
            throw new IllegalArgumentException("step metrics must not be negative");
        }
    }
}
