package org.smileyface.crawlcore.worker;

import java.util.List;
import java.util.Objects;

/**
 * Result of one fetch attempt.
 */
public final class FetchOutcome {

    private final FailureKind failure;
    private final String message;
    private final byte[] content;
    private final List<String> discoveredUrls;

    private FetchOutcome(FailureKind failure, String message, byte[] content, List<String> discoveredUrls) {
        this.failure = failure;
        this.message = message;
        this.content = content;
        this.discoveredUrls = discoveredUrls;
    }

    public static FetchOutcome success(byte[] content) {
        return new FetchOutcome(null, null, content, List.of());
    }

    public static FetchOutcome success(byte[] content, List<String> discoveredUrls) {
        return new FetchOutcome(null, null, content, discoveredUrls == null ? List.of() : List.copyOf(discoveredUrls));
    }

    public static FetchOutcome failure(FailureKind kind, String message) {
        return new FetchOutcome(Objects.requireNonNull(kind, "kind"), message, null, List.of());
    }

    public boolean isSuccess() { return failure == null; }
    public FailureKind getFailure() { return failure; }
    public String getMessage() { return message; }
    public byte[] getContent() { return content; }
    public List<String> getDiscoveredUrls() { return discoveredUrls; }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchOutcome{success, discovered=" + discoveredUrls.size() + '}'
                : "FetchOutcome{" + failure + ": " + message + '}';
    }
}
