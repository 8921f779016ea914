package org.smileyface.crawlcore.model;

import java.util.Objects;

/**
 * Static description of one pipeline step. Step numbers are 0-based and contiguous.
 *
 * @param continueOnError a failure of this step is recorded as skipped and the run goes on
 */
public record StepDefinition(int number, String name, StepKind kind, boolean continueOnError) {

    public StepDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (number < 0) {
            throw new IllegalArgumentException("step number must be >= 0, was " + number);
        }
    }

    public static StepDefinition queue(int number, String name) {
        return new StepDefinition(number, name, StepKind.QUEUE, false);
    }

    public static StepDefinition frontier(int number, String name) {
        return new StepDefinition(number, name, StepKind.FRONTIER, false);
    }

    public StepDefinition withContinueOnError() {
        return new StepDefinition(number, name, kind, true);
    }
}
