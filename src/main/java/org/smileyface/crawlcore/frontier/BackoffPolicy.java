package org.smileyface.crawlcore.frontier;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential retry delay: {@code base * 2^(attempt-1)}, never above {@code cap}.
 * Delays are non-decreasing in the attempt number.
 */
public final class BackoffPolicy {

    private final Duration base;
    private final Duration cap;

    public BackoffPolicy(Duration base, Duration cap) {
        this.base = Objects.requireNonNull(base, "base");
        this.cap = Objects.requireNonNull(cap, "cap");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("backoff base must be positive: " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("backoff cap " + cap + " is below base " + base);
        }
    }

    /**
     * @param attempt 1-based attempt number; values below 1 are treated as 1
     */
    public Duration delay(int attempt) {
        int n = Math.max(1, attempt);
        long baseMs = base.toMillis();
        long capMs = cap.toMillis();
        // 2^62 already overflows any sane base, stop shifting well before that
        int shift = Math.min(n - 1, 40);
        long factor = 1L << shift;
        if (baseMs > capMs / factor) {
            return cap;
        }
        return Duration.ofMillis(Math.min(capMs, baseMs * factor));
    }

    public Duration getBase() {
        return base;
    }

    public Duration getCap() {
        return cap;
    }

    @Override
    public String toString() {
        return "BackoffPolicy{base=" + base + ", cap=" + cap + '}';
    }
}
