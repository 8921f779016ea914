package org.smileyface.crawlcore.model;

import java.util.Map;

/**
 * Aggregate view of the egress pool for status reporting.
 */
public record ProxyPoolHealth(int total,
                              int available,
                              int suspended,
                              double averageHealthScore,
                              Map<String, Integer> byCountry,
                              Map<String, Integer> byType) {
}
