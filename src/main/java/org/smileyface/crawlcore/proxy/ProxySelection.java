package org.smileyface.crawlcore.proxy;

import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.model.ProxyPoolHealth;
import org.smileyface.crawlcore.model.ProxyType;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Selection and reporting rules shared by the pool implementations.
 */
final class ProxySelection {

    static final Comparator<ProxyEndpoint> PREFERENCE = Comparator
            .comparingDouble(ProxyEndpoint::getHealthScore).reversed()
            .thenComparing(ProxyEndpoint::getLastUsedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(ProxyEndpoint::getEndpointId);

    private ProxySelection() {
    }

    static boolean matches(ProxyEndpoint e, String countryCode, ProxyType type) {
        return (countryCode == null || countryCode.equalsIgnoreCase(e.getCountryCode()))
                && (type == null || type == e.getType());
    }

    static Optional<ProxyEndpoint> best(Collection<ProxyEndpoint> endpoints, String countryCode, ProxyType type, Instant now) {
        return endpoints.stream()
                .filter(e -> matches(e, countryCode, type))
                .filter(e -> !e.isSuspendedAt(now))
                .min(PREFERENCE);
    }

    static ProxyPoolHealth summarize(Collection<ProxyEndpoint> endpoints, Instant now) {
        int suspended = 0;
        double scoreSum = 0.0;
        Map<String, Integer> byCountry = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        for (ProxyEndpoint e : endpoints) {
            if (e.isSuspendedAt(now)) suspended++;
            scoreSum += e.getHealthScore();
            byCountry.merge(e.getCountryCode() == null ? "any" : e.getCountryCode(), 1, Integer::sum);
            byType.merge(e.getType() == null ? "unknown" : e.getType().dbValue(), 1, Integer::sum);
        }
        int total = endpoints.size();
        return new ProxyPoolHealth(total, total - suspended, suspended,
                total == 0 ? 0.0 : scoreSum / total, byCountry, byType);
    }
}
