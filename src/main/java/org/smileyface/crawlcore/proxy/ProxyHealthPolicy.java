package org.smileyface.crawlcore.proxy;

import org.smileyface.crawlcore.model.ProxyEndpoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Scoring and circuit-breaker rules shared by every {@link ProxyPool} implementation.
 */
public record ProxyHealthPolicy(int failureThreshold,
                                Duration cooldown,
                                double emaAlpha,
                                double initialHealth,
                                double minHealthyScore) {

    public ProxyHealthPolicy {
        Objects.requireNonNull(cooldown, "cooldown");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was " + failureThreshold);
        }
        if (emaAlpha <= 0.0 || emaAlpha > 1.0) {
            throw new IllegalArgumentException("emaAlpha must be in (0, 1], was " + emaAlpha);
        }
        if (initialHealth < 0.0 || initialHealth > 1.0) {
            throw new IllegalArgumentException("initialHealth must be in [0, 1], was " + initialHealth);
        }
        if (minHealthyScore < 0.0 || minHealthyScore > 1.0) {
            throw new IllegalArgumentException("minHealthyScore must be in [0, 1], was " + minHealthyScore);
        }
    }

    /**
     * Applies one outcome to the endpoint in place.
     *
     * @return true when this outcome opened the circuit
     */
    public boolean apply(ProxyEndpoint endpoint, boolean success, long latencyMs, Instant now) {
        double sample = success ? 1.0 : 0.0;
        endpoint.setHealthScore(emaAlpha * sample + (1.0 - emaAlpha) * endpoint.getHealthScore());
        if (latencyMs >= 0) {
            double prev = endpoint.getAvgLatencyMs();
            long samples = endpoint.getSuccessCount() + endpoint.getFailureCount();
            endpoint.setAvgLatencyMs(samples == 0 ? latencyMs : emaAlpha * latencyMs + (1.0 - emaAlpha) * prev);
        }
        if (success) {
            endpoint.setSuccessCount(endpoint.getSuccessCount() + 1);
            endpoint.setConsecutiveFailures(0);
            endpoint.setSuspendedUntil(null);
            return false;
        }
        endpoint.setFailureCount(endpoint.getFailureCount() + 1);
        endpoint.setConsecutiveFailures(endpoint.getConsecutiveFailures() + 1);
        if (endpoint.getConsecutiveFailures() >= failureThreshold) {
            boolean wasOpen = endpoint.isSuspendedAt(now);
            endpoint.setSuspendedUntil(now.plus(cooldown));
            return !wasOpen;
        }
        return false;
    }

    /**
     * A sticky binding survives only while its endpoint stays healthy.
     */
    public boolean isHealthy(ProxyEndpoint endpoint, Instant now) {
        return !endpoint.isSuspendedAt(now) && endpoint.getHealthScore() >= minHealthyScore;
    }
}
