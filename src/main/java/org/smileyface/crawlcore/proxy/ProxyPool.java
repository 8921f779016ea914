package org.smileyface.crawlcore.proxy;

import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.model.ProxyType;

import java.util.List;
import java.util.Optional;

/**
 * Health-scored pool of egress endpoints with a per-endpoint circuit breaker and sticky sessions.
 */
public interface ProxyPool {

    /**
     * Adds the endpoint, or updates address, credentials, country and type of an existing id
     * while keeping its health.
     */
    void register(ProxyEndpoint endpoint);

    /**
     * Picks an endpoint. A sticky key bound to a still healthy endpoint matching the filters gets
     * the same endpoint back; otherwise the healthiest eligible endpoint is chosen (least recently
     * used on ties) and the key is rebound to it. Null filters match anything.
     *
     * @return empty when no endpoint is eligible
     */
    Optional<ProxyEndpoint> acquire(String countryCode, ProxyType type, String stickyKey);

    /**
     * Feeds one request outcome into the endpoint's health score and breaker.
     */
    void reportOutcome(String endpointId, boolean success, long latencyMs);

    void unbind(String stickyKey);

    ProxyPoolHealth healthSummary();

    List<ProxyEndpoint> endpoints();
}
