package org.smileyface.crawlcore.worker;

import org.smileyface.crawlcore.model.ProxyType;

/**
 * Egress filters a fleet fetches through. A null country or type matches any endpoint.
 */
public record EgressRequirement(String countryCode, ProxyType type) {

    public static EgressRequirement any() {
        return new EgressRequirement(null, null);
    }
}
