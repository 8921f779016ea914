package org.smileyface.crawlcore.worker;

/**
 * Raised by a worker when a fetch reports a fatal failure; the run halts at the current step.
 */
public class FatalRunException extends RuntimeException {

    private final String runId;
    private final int stepNumber;

    public FatalRunException(String runId, int stepNumber, String message) {
        super(message);
        this.runId = runId;
        this.stepNumber = stepNumber;
    }

    public String getRunId() {
        return runId;
    }

    public int getStepNumber() {
        return stepNumber;
    }
}
