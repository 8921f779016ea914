package org.smileyface.crawlcore.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Restricts a claim to one run and optionally one step. A null run id matches every run.
 *
 * @param heartbeatExpiry claims whose last heartbeat is older than this are reclaimable
 */
public record ClaimScope(String runId, Integer stepNumber, Duration heartbeatExpiry) {

    public ClaimScope {
        Objects.requireNonNull(heartbeatExpiry, "heartbeatExpiry");
        if (heartbeatExpiry.isNegative() || heartbeatExpiry.isZero()) {
            throw new IllegalArgumentException("heartbeatExpiry must be positive, was " + heartbeatExpiry);
        }
    }

    public static ClaimScope anyRun(Duration heartbeatExpiry) {
        return new ClaimScope(null, null, heartbeatExpiry);
    }

    public static ClaimScope step(String runId, int stepNumber, Duration heartbeatExpiry) {
        return new ClaimScope(runId, stepNumber, heartbeatExpiry);
    }

    boolean matches(String itemRunId, int itemStep) {
        return (runId == null || runId.equals(itemRunId)) && (stepNumber == null || stepNumber == itemStep);
    }
}
