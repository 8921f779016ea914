package org.smileyface.crawlcore.pipeline;

import java.util.Objects;

/**
 * One unit of input for a step: a work item's natural key and payload, or a seed address for a
 * discovery step (where the key is the url and the payload is ignored).
 */
public record Seed(String key, byte[] payload, int priority) {

    public Seed {
        Objects.requireNonNull(key, "key");
    }

    public static Seed of(String key, byte[] payload, int priority) {
        return new Seed(key, payload, priority);
    }

    public static Seed url(String url, int priority) {
        return new Seed(url, null, priority);
    }
}
