package org.smileyface.crawlcore.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.model.ProxyType;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-process {@link ProxyPool}.
 */
public class InMemoryProxyPool implements ProxyPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProxyPool.class);

    private final Clock clock;
    private final ProxyHealthPolicy policy;
    private final Map<String, ProxyEndpoint> endpoints = new LinkedHashMap<>();
    private final Map<String, String> sticky = new HashMap<>();

    public InMemoryProxyPool(Clock clock, ProxyHealthPolicy policy) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public synchronized void register(ProxyEndpoint endpoint) {
        Objects.requireNonNull(endpoint.getEndpointId(), "endpointId");
        ProxyType type = endpoint.getType() == null ? ProxyType.DATACENTER : endpoint.getType();
        ProxyEndpoint existing = endpoints.get(endpoint.getEndpointId());
        if (existing != null) {
            existing.setAddress(endpoint.getAddress());
            existing.setUsername(endpoint.getUsername());
            existing.setPassword(endpoint.getPassword());
            existing.setCountryCode(endpoint.getCountryCode());
            existing.setType(type);
            return;
        }
        ProxyEndpoint copy = new ProxyEndpoint(endpoint);
        copy.setType(type);
        copy.setHealthScore(policy.initialHealth());
        copy.setConsecutiveFailures(0);
        copy.setSuspendedUntil(null);
        endpoints.put(copy.getEndpointId(), copy);
        log.info("Proxy endpoint {} registered (country={}, type={})", copy.getEndpointId(), copy.getCountryCode(), copy.getType());
    }

    @Override
    public synchronized Optional<ProxyEndpoint> acquire(String countryCode, ProxyType type, String stickyKey) {
        Instant now = clock.instant();
        if (stickyKey != null) {
            ProxyEndpoint bound = endpoints.get(sticky.get(stickyKey));
            if (bound != null && ProxySelection.matches(bound, countryCode, type) && policy.isHealthy(bound, now)) {
                bound.setLastUsedAt(now);
                return Optional.of(new ProxyEndpoint(bound));
            }
        }
        Optional<ProxyEndpoint> chosen = ProxySelection.best(endpoints.values(), countryCode, type, now);
        if (chosen.isEmpty()) {
            log.debug("No eligible proxy endpoint for country={}, type={}", countryCode, type);
            if (stickyKey != null) sticky.remove(stickyKey);
            return Optional.empty();
        }
        ProxyEndpoint e = chosen.get();
        e.setLastUsedAt(now);
        if (stickyKey != null) {
            sticky.put(stickyKey, e.getEndpointId());
        }
        return Optional.of(new ProxyEndpoint(e));
    }

    @Override
    public synchronized void reportOutcome(String endpointId, boolean success, long latencyMs) {
        ProxyEndpoint e = endpoints.get(endpointId);
        if (e == null) {
            throw new IllegalArgumentException("Unknown proxy endpoint " + endpointId);
        }
        if (policy.apply(e, success, latencyMs, clock.instant())) {
            log.warn("Proxy endpoint {} suspended until {} after {} consecutive failures",
                    endpointId, e.getSuspendedUntil(), e.getConsecutiveFailures());
        }
    }

    @Override
    public synchronized void unbind(String stickyKey) {
        sticky.remove(stickyKey);
    }

    @Override
    public synchronized ProxyPoolHealth healthSummary() {
        return ProxySelection.summarize(endpoints.values(), clock.instant());
    }

    @Override
    public synchronized List<ProxyEndpoint> endpoints() {
        return endpoints.values().stream().map(ProxyEndpoint::new).toList();
    }
}
