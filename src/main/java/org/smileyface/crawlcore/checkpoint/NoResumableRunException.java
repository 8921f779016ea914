package org.smileyface.crawlcore.checkpoint;

/**
 * Raised by a resume request when the fleet has no run in a resumable status.
 * Callers normally react by starting a fresh run.
 */
public class NoResumableRunException extends RuntimeException {

    private final String fleetName;

    public NoResumableRunException(String fleetName) {
        super("No resumable run for fleet " + fleetName);
        this.fleetName = fleetName;
    }

    public String getFleetName() {
        return fleetName;
    }
}
