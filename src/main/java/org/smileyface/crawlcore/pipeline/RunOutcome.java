package org.smileyface.crawlcore.pipeline;

import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;

/**
 * Terminal result of driving a run. Only a completed run exits with 0.
 */
public record RunOutcome(String runId, String fleetName, RunStatus status, String failureStepName, String errorMessage) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_RUN_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    public static RunOutcome of(Run run) {
        return new RunOutcome(run.getRunId(), run.getFleetName(), run.getStatus(), run.getFailureStepName(), run.getErrorMessage());
    }

    public int exitCode() {
        return status == RunStatus.COMPLETED ? EXIT_OK : EXIT_RUN_FAILED;
    }
}
