package org.smileyface.crawlcore.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One discovered target address. The fingerprint is the dedup key within a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FrontierEntry {

    private String runId;
    private String urlFingerprint;     // SHA-256 of the normalized url
    private String url;                // normalized absolute url
    private String domain;
    private int priority;
    private int depth;
    private String referer;
    private FrontierStatus status = FrontierStatus.QUEUED;
    private int retryCount;
    private Instant nextEligibleAt;
    private Instant discoveredAt;
    private long sequence;             // discovery order within the run

    public FrontierEntry() {
    }

    public FrontierEntry(FrontierEntry other) {
        this.runId = other.runId;
        this.urlFingerprint = other.urlFingerprint;
        this.url = other.url;
        this.domain = other.domain;
        this.priority = other.priority;
        this.depth = other.depth;
        this.referer = other.referer;
        this.status = other.status;
        this.retryCount = other.retryCount;
        this.nextEligibleAt = other.nextEligibleAt;
        this.discoveredAt = other.discoveredAt;
        this.sequence = other.sequence;
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getUrlFingerprint() { return urlFingerprint; }
    public void setUrlFingerprint(String urlFingerprint) { this.urlFingerprint = urlFingerprint; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getReferer() { return referer; }
    public void setReferer(String referer) { this.referer = referer; }

    public FrontierStatus getStatus() { return status; }
    public void setStatus(FrontierStatus status) { this.status = status; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public Instant getNextEligibleAt() { return nextEligibleAt; }
    public void setNextEligibleAt(Instant nextEligibleAt) { this.nextEligibleAt = nextEligibleAt; }

    public Instant getDiscoveredAt() { return discoveredAt; }
    public void setDiscoveredAt(Instant discoveredAt) { this.discoveredAt = discoveredAt; }

    public long getSequence() { return sequence; }
    public void setSequence(long sequence) { this.sequence = sequence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrontierEntry that = (FrontierEntry) o;
        return priority == that.priority
                && depth == that.depth
                && retryCount == that.retryCount
                && sequence == that.sequence
                && Objects.equals(runId, that.runId)
                && Objects.equals(urlFingerprint, that.urlFingerprint)
                && Objects.equals(url, that.url)
                && Objects.equals(domain, that.domain)
                && Objects.equals(referer, that.referer)
                && status == that.status
                && Objects.equals(nextEligibleAt, that.nextEligibleAt)
                && Objects.equals(discoveredAt, that.discoveredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, urlFingerprint, url, domain, priority, depth, referer, status,
                retryCount, nextEligibleAt, discoveredAt, sequence);
    }

    @Override
    public String toString() {
        return "FrontierEntry{" +
                "url='" + url + '\'' +
                ", status=" + status +
                ", priority=" + priority +
                ", depth=" + depth +
                ", retryCount=" + retryCount +
                '}';
    }
}
