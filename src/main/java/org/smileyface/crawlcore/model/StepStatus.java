package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of one pipeline step. Persisted lower-case in {@code pipeline_steps.status}.
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    SKIPPED;

    /**
     * Completed and skipped steps are never re-run on resume.
     */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus fromDb(String value) {
        return StepStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
