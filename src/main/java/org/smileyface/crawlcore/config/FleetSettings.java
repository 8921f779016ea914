package org.smileyface.crawlcore.config;

import org.smileyface.crawlcore.frontier.FrontierPolicy;

import java.time.Duration;

/**
 * Immutable, validated tunables for one fleet: global defaults merged with the fleet's overrides.
 */
public record FleetSettings(String fleetName,
                            Duration heartbeatExpiry,
                            Duration heartbeatInterval,
                            int maxAttempts,
                            int claimBatchSize,
                            FrontierPolicy frontier,
                            Duration staleRunMaxIdle,
                            int workerCount,
                            Duration idleBackoff,
                            int localRetries,
                            Duration awaitTimeout) {
}
