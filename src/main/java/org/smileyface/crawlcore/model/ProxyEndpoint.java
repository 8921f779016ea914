package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One network identity in the egress pool. Health fields are mutated continuously by
 * outcome reporting.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProxyEndpoint {

    private String endpointId;
    private String address;            // scheme://host:port
    private String username;
    private String password;
    private String countryCode;
    private ProxyType type;

    private double healthScore;
    private int consecutiveFailures;
    private Instant suspendedUntil;    // circuit open while in the future
    private Instant lastUsedAt;
    private double avgLatencyMs;
    private long successCount;
    private long failureCount;

    public ProxyEndpoint() {
    }

    public ProxyEndpoint(String endpointId, String address, String countryCode, ProxyType type) {
        this.endpointId = endpointId;
        this.address = address;
        this.countryCode = countryCode;
        this.type = type;
    }

    public ProxyEndpoint(ProxyEndpoint other) {
        this.endpointId = other.endpointId;
        this.address = other.address;
        this.username = other.username;
        this.password = other.password;
        this.countryCode = other.countryCode;
        this.type = other.type;
        this.healthScore = other.healthScore;
        this.consecutiveFailures = other.consecutiveFailures;
        this.suspendedUntil = other.suspendedUntil;
        this.lastUsedAt = other.lastUsedAt;
        this.avgLatencyMs = other.avgLatencyMs;
        this.successCount = other.successCount;
        this.failureCount = other.failureCount;
    }

    /**
     * True while the circuit breaker is open at the given instant.
     */
    public boolean isSuspendedAt(Instant now) {
        return suspendedUntil != null && suspendedUntil.isAfter(now);
    }

    public String getEndpointId() { return endpointId; }
    public void setEndpointId(String endpointId) { this.endpointId = endpointId; }

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    @JsonIgnore
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getCountryCode() { return countryCode; }
    public void setCountryCode(String countryCode) { this.countryCode = countryCode; }

    public ProxyType getType() { return type; }
    public void setType(ProxyType type) { this.type = type; }

    public double getHealthScore() { return healthScore; }
    public void setHealthScore(double healthScore) { this.healthScore = healthScore; }

    public int getConsecutiveFailures() { return consecutiveFailures; }
    public void setConsecutiveFailures(int consecutiveFailures) { this.consecutiveFailures = consecutiveFailures; }

    public Instant getSuspendedUntil() { return suspendedUntil; }
    public void setSuspendedUntil(Instant suspendedUntil) { this.suspendedUntil = suspendedUntil; }

    public Instant getLastUsedAt() { return lastUsedAt; }
    public void setLastUsedAt(Instant lastUsedAt) { this.lastUsedAt = lastUsedAt; }

    public double getAvgLatencyMs() { return avgLatencyMs; }
    public void setAvgLatencyMs(double avgLatencyMs) { this.avgLatencyMs = avgLatencyMs; }

    public long getSuccessCount() { return successCount; }
    public void setSuccessCount(long successCount) { this.successCount = successCount; }

    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }

    @Override
    public String toString() {
        return "ProxyEndpoint{" +
                "endpointId='" + endpointId + '\'' +
                ", countryCode='" + countryCode + '\'' +
                ", type=" + type +
                ", healthScore=" + healthScore +
                ", consecutiveFailures=" + consecutiveFailures +
                ", suspendedUntil=" + suspendedUntil +
                '}';
    }
}
