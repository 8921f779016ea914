package org.smileyface.crawlcore.worker;

/**
 * What a worker hands to the {@link Fetcher}: a work item key and payload for queue steps, or an
 * address and link depth for frontier steps.
 */
public record FetchTarget(String runId, int stepNumber, String key, byte[] payload, String url, int depth) {

    public static FetchTarget item(String runId, int stepNumber, String naturalKey, byte[] payload) {
        return new FetchTarget(runId, stepNumber, naturalKey, payload, null, 0);
    }

    public static FetchTarget address(String runId, int stepNumber, String url, int depth) {
        return new FetchTarget(runId, stepNumber, url, null, url, depth);
    }
}
