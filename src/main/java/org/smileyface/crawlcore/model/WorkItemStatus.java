package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status of a claimable work item. Persisted lower-case in {@code work_items.status}.
 */
public enum WorkItemStatus {
    /** Waiting for its first claim. */
    PENDING,

    /** Held by a worker; the claim stays live while heartbeats keep arriving. */
    CLAIMED,

    /** Processed successfully. Terminal. */
    COMPLETED,

    /** The last attempt failed; the item can be claimed again. */
    FAILED,

    /** Exhausted its attempts or failed structurally. Terminal, kept for manual triage. */
    DEAD;

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD;
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkItemStatus fromDb(String value) {
        return WorkItemStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
