package org.smileyface.crawlcore.worker;

import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.model.ProxyEndpoint;

/**
 * Performs the actual network fetch and extraction for one target. Supplied per fleet.
 */
@FunctionalInterface
public interface Fetcher {

    /**
     * @param proxy   egress endpoint to use, or null when the fleet fetches directly
     * @param browser rendering process to drive, or null when the fleet needs none
     * @return a success or a classified failure; an exception is treated as {@link FailureKind#TRANSIENT}
     */
    FetchOutcome fetch(FetchTarget target, ProxyEndpoint proxy, BrowserInstance browser) throws Exception;
}
