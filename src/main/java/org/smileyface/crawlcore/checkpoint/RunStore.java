package org.smileyface.crawlcore.checkpoint;

import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.model.Step;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistence for runs and their steps. Objects returned are detached copies; changes are
 * written back explicitly with {@link #updateRun(Run)} / {@link #updateStep(Step)}.
 */
public interface RunStore {

    void insertRun(Run run, List<Step> steps);

    Optional<Run> findRun(String runId);

    /**
     * Locks the row for the rest of the surrounding {@link #inTransaction(Supplier)} where the
     * backend supports it.
     */
    Optional<Run> findRunForUpdate(String runId);

    /**
     * Best resume candidate for the fleet among running, stopped and failed runs, ordered by
     * {@code items_scraped DESC NULLS LAST, started_at DESC}.
     */
    Optional<Run> findResumable(String fleetName);

    /** Most recent runs first; a null fleet lists every fleet. */
    List<Run> listRuns(String fleetName, int limit);

    List<Run> findByStatus(RunStatus status);

    void updateRun(Run run);

    List<Step> findSteps(String runId);

    Optional<Step> findStep(String runId, int stepNumber);

    void updateStep(Step step);

    /**
     * Moves a running run to stopped only if it is still running and has not been touched
     * since {@code cutoff}.
     */
    boolean stopIfIdleSince(String runId, Instant cutoff, Instant now);

    boolean setStopRequested(String runId, boolean requested, Instant now);

    void addItemsScraped(String runId, long delta, Instant now);

    void touch(String runId, Instant now);

    <T> T inTransaction(Supplier<T> work);
}
