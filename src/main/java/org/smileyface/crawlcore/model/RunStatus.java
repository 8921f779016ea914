package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a pipeline run. Persisted lower-case in {@code pipeline_runs.status}.
 */
public enum RunStatus {
    /** Created but not yet started by a driver. */
    PENDING,

    /** A driver is currently executing steps. */
    RUNNING,

    /** Every step finished as completed or skipped. */
    COMPLETED,

    /** A step failed fatally; the run can be resumed from the failure point. */
    FAILED,

    /** Stopped cooperatively or recovered as stale; the run can be resumed. */
    STOPPED;

    private static final Set<RunStatus> RESUMABLE = EnumSet.of(RUNNING, STOPPED, FAILED);

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isResumable() {
        return RESUMABLE.contains(this);
    }

    public static Set<RunStatus> resumable() {
        return EnumSet.copyOf(RESUMABLE);
    }

    @JsonCreator
    public static RunStatus fromDb(String value) {
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
