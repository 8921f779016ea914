package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Crawl state of a discovered address.
 */
public enum FrontierStatus {
    QUEUED,
    IN_FLIGHT,
    DONE,
    /** Failed at least once and waiting for its backoff to elapse. */
    FAILED,
    PERMANENTLY_FAILED;

    public boolean isLive() {
        return this == QUEUED || this == IN_FLIGHT || this == FAILED;
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FrontierStatus fromDb(String value) {
        return FrontierStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
