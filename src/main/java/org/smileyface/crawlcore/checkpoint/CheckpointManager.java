package org.smileyface.crawlcore.checkpoint;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.model.Step;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.model.StepMetrics;
import org.smileyface.crawlcore.model.StepStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Owns every mutation of runs and steps: creation, resume selection, per-step checkpoints,
 * stale recovery and the final aggregate write.
 */
public class CheckpointManager {

    private static final Logger log = LogManager.getLogger();

    private final RunStore store;
    private final Clock clock;

    public CheckpointManager(RunStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts a fresh run, or resumes the fleet's best candidate run.
     *
     * @throws NoResumableRunException when {@code fresh} is false and the fleet has no
     *                                 running, stopped or failed run
     */
    public RunContext initRun(String fleetName, boolean fresh, List<StepDefinition> steps) {
        if (fleetName == null || fleetName.isBlank()) {
            throw new IllegalArgumentException("fleetName must not be blank");
        }
        checkDefinitions(steps);
        return fresh ? createRun(fleetName, steps) : resumeRun(fleetName, steps);
    }

    private RunContext createRun(String fleetName, List<StepDefinition> definitions) {
        Instant now = clock.instant();
        Run run = new Run();
        run.setRunId(UUID.randomUUID().toString());
        run.setFleetName(fleetName);
        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(now);
        run.setUpdatedAt(now);
        run.setStepCount(definitions.size());
        run.setCurrentStep(0);
        run.setItemsScraped(0L);
        List<Step> steps = new ArrayList<>(definitions.size());
        for (StepDefinition d : definitions) {
            steps.add(new Step(run.getRunId(), d.number(), d.name()));
        }
        store.insertRun(run, steps);
        log.info("Run {} created for fleet {} with {} steps", run.getRunId(), fleetName, steps.size());
        return new RunContext(run.getRunId(), fleetName, definitions, false, 0);
    }

    private RunContext resumeRun(String fleetName, List<StepDefinition> definitions) {
        return store.inTransaction(() -> {
            Run run = store.findResumable(fleetName).orElseThrow(() -> new NoResumableRunException(fleetName));
            if (run.getStepCount() != definitions.size()) {
                throw new IllegalStateException("Run " + run.getRunId() + " has " + run.getStepCount()
                        + " steps but the pipeline of fleet " + fleetName + " defines " + definitions.size());
            }
            RunStatus previous = run.getStatus();
            Instant now = clock.instant();
            run.setStatus(RunStatus.RUNNING);
            run.setStopRequested(false);
            run.setEndedAt(null);
            run.setErrorMessage(null);
            run.setUpdatedAt(now);
            int start = firstUnfinished(store.findSteps(run.getRunId()), run.getStepCount());
            run.setCurrentStep(start);
            store.updateRun(run);
            log.info("Run {} of fleet {} resumed from {} at step {} (itemsScraped={})",
                    run.getRunId(), fleetName, previous, start, run.getItemsScraped());
            return new RunContext(run.getRunId(), fleetName, definitions, true, start);
        });
    }

    /**
     * First step that is neither completed nor skipped; the step count when every step is done.
     */
    public int resumePoint(String runId) {
        Run run = requireRun(runId);
        return firstUnfinished(store.findSteps(runId), run.getStepCount());
    }

    private static int firstUnfinished(List<Step> steps, int stepCount) {
        for (Step s : steps) {
            if (!s.getStatus().isDone()) {
                return s.getStepNumber();
            }
        }
        return stepCount;
    }

    /**
     * @throws CheckpointViolationException if the step is already completed or skipped
     */
    public void markStepStart(String runId, int stepNumber) {
        store.inTransaction(() -> {
            Run run = lockRun(runId);
            Step step = requireStep(runId, stepNumber);
            if (step.getStatus().isDone()) {
                throw new CheckpointViolationException("Run " + runId + ": step " + stepNumber
                        + " is already " + step.getStatus().name().toLowerCase());
            }
            Instant now = clock.instant();
            step.setStatus(StepStatus.IN_PROGRESS);
            step.setStartedAt(now);
            step.setCompletedAt(null);
            step.setDurationSeconds(null);
            step.setErrorMessage(null);
            store.updateStep(step);
            run.setCurrentStep(stepNumber);
            run.setUpdatedAt(now);
            store.updateRun(run);
            return null;
        });
        log.info("Run {} step {} -> IN_PROGRESS", runId, stepNumber);
    }

    /**
     * @throws CheckpointViolationException if an earlier step is neither completed nor skipped
     */
    public void markStepComplete(String runId, int stepNumber, StepMetrics metrics) {
        Step done = store.inTransaction(() -> {
            Run run = lockRun(runId);
            List<Step> steps = store.findSteps(runId);
            for (Step earlier : steps) {
                if (earlier.getStepNumber() < stepNumber && !earlier.getStatus().isDone()) {
                    throw new CheckpointViolationException("Run " + runId + ": cannot complete step " + stepNumber
                            + " while step " + earlier.getStepNumber() + " is " + earlier.getStatus().dbValue());
                }
            }
            Step step = requireStep(runId, stepNumber);
            Instant now = clock.instant();
            closeStep(step, StepStatus.COMPLETED, metrics, now);
            store.updateStep(step);
            run.setUpdatedAt(now);
            store.updateRun(run);
            return step;
        });
        log.info("Run {} step {} ({}) -> COMPLETED after {} s (metrics={})",
                runId, stepNumber, done.getName(), done.getDurationSeconds(), done.getMetrics());
    }

    /**
     * Records a step failure. A continue-on-error step is stored as skipped with its error kept;
     * any other failure halts the run.
     *
     * @return true when the run was halted
     */
    public boolean markStepFailed(String runId, int stepNumber, StepMetrics metrics, String error, boolean continueOnError) {
        return store.inTransaction(() -> {
            Run run = lockRun(runId);
            Step step = requireStep(runId, stepNumber);
            Instant now = clock.instant();
            closeStep(step, continueOnError ? StepStatus.SKIPPED : StepStatus.FAILED, metrics, now);
            step.setErrorMessage(error);
            store.updateStep(step);
            run.setUpdatedAt(now);
            if (continueOnError) {
                store.updateRun(run);
                log.warn("Run {} step {} ({}) failed but continues on error: {}", runId, stepNumber, step.getName(), error);
                return false;
            }
            run.setStatus(RunStatus.FAILED);
            run.setFailureStep(stepNumber);
            run.setFailureStepName(step.getName());
            run.setErrorMessage(error);
            run.setEndedAt(now);
            store.updateRun(run);
            log.error("Run {} halted: step {} ({}) -> FAILED: {}", runId, stepNumber, step.getName(), error);
            return true;
        });
    }

    public void markStepSkipped(String runId, int stepNumber, String reason) {
        store.inTransaction(() -> {
            Run run = lockRun(runId);
            Step step = requireStep(runId, stepNumber);
            Instant now = clock.instant();
            closeStep(step, StepStatus.SKIPPED, step.getMetrics(), now);
            step.setErrorMessage(reason);
            store.updateStep(step);
            run.setUpdatedAt(now);
            store.updateRun(run);
            return null;
        });
        log.info("Run {} step {} -> SKIPPED ({})", runId, stepNumber, reason);
    }

    private static void closeStep(Step step, StepStatus status, StepMetrics metrics, Instant now) {
        step.setStatus(status);
        if (step.getStartedAt() == null) {
            step.setStartedAt(now);
        }
        step.setCompletedAt(now);
        step.setDurationSeconds(Duration.between(step.getStartedAt(), now).toMillis() / 1000.0);
        step.setMetrics(metrics);
    }

    /**
     * Marks every running run without an update for {@code maxIdle} as stopped, which makes it
     * resumable by another driver.
     *
     * @return ids of the recovered runs
     */
    public List<String> staleRunRecovery(Duration maxIdle) {
        Objects.requireNonNull(maxIdle, "maxIdle");
        return staleRunRecovery(fleet -> maxIdle);
    }

    /**
     * Same as {@link #staleRunRecovery(Duration)} with the idle threshold chosen per fleet.
     */
    public List<String> staleRunRecovery(Function<String, Duration> maxIdleByFleet) {
        Instant now = clock.instant();
        List<String> recovered = new ArrayList<>();
        for (Run run : store.findByStatus(RunStatus.RUNNING)) {
            Instant cutoff = now.minus(maxIdleByFleet.apply(run.getFleetName()));
            if (run.getUpdatedAt() != null && !run.getUpdatedAt().isBefore(cutoff)) {
                continue;
            }
            if (store.stopIfIdleSince(run.getRunId(), cutoff, now)) {
                recovered.add(run.getRunId());
                log.warn("Run {} of fleet {} recovered as stale (last update {}), now STOPPED",
                        run.getRunId(), run.getFleetName(), run.getUpdatedAt());
            }
        }
        return recovered;
    }

    /**
     * Writes the run aggregates and its terminal status: completed when every step is done,
     * failed when a step failed, stopped otherwise.
     */
    public Run finalizeRun(String runId) {
        Run result = store.inTransaction(() -> {
            Run run = lockRun(runId);
            List<Step> steps = store.findSteps(runId);
            Instant now = clock.instant();

            double total = 0.0;
            Step slowest = null;
            Step firstFailed = null;
            boolean allDone = !steps.isEmpty();
            for (Step s : steps) {
                Double d = s.getDurationSeconds();
                if (d != null) {
                    total += d;
                    if (slowest == null || d > slowest.getDurationSeconds()) {
                        slowest = s;
                    }
                }
                if (s.getStatus() == StepStatus.FAILED && firstFailed == null) {
                    firstFailed = s;
                }
                allDone &= s.getStatus().isDone();
            }
            run.setTotalRuntimeSeconds(total);
            if (slowest != null) {
                run.setSlowestStep(slowest.getStepNumber());
                run.setSlowestStepName(slowest.getName());
            }
            if (firstFailed != null) {
                run.setFailureStep(firstFailed.getStepNumber());
                run.setFailureStepName(firstFailed.getName());
                if (run.getErrorMessage() == null) {
                    run.setErrorMessage(firstFailed.getErrorMessage());
                }
            }
            if (allDone) {
                run.setStatus(RunStatus.COMPLETED);
                run.setCurrentStep(run.getStepCount());
            } else if (firstFailed != null) {
                run.setStatus(RunStatus.FAILED);
            } else {
                run.setStatus(RunStatus.STOPPED);
            }
            run.setEndedAt(now);
            run.setUpdatedAt(now);
            store.updateRun(run);
            return run;
        });
        log.info("Run {} finalized as {} (totalRuntime={} s, slowestStep={}, failureStep={})",
                runId, result.getStatus(), result.getTotalRuntimeSeconds(),
                result.getSlowestStepName(), result.getFailureStepName());
        return result;
    }

    /**
     * Sets the cooperative stop flag. Workers observe it between items.
     *
     * @return false when the run is unknown or already terminal
     */
    public boolean requestStop(String runId) {
        Optional<Run> run = store.findRun(runId);
        if (run.isEmpty()) {
            return false;
        }
        RunStatus status = run.get().getStatus();
        if (status == RunStatus.COMPLETED || status == RunStatus.FAILED) {
            log.info("Stop ignored for run {}: already {}", runId, status);
            return false;
        }
        boolean set = store.setStopRequested(runId, true, clock.instant());
        if (set) {
            log.info("Stop requested for run {}", runId);
        }
        return set;
    }

    public boolean isStopRequested(String runId) {
        return store.findRun(runId).map(Run::isStopRequested).orElse(false);
    }

    public void markStopped(String runId) {
        store.inTransaction(() -> {
            Run run = lockRun(runId);
            Instant now = clock.instant();
            run.setStatus(RunStatus.STOPPED);
            run.setEndedAt(now);
            run.setUpdatedAt(now);
            store.updateRun(run);
            return null;
        });
        log.info("Run {} -> STOPPED", runId);
    }

    public void addItemsScraped(String runId, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, was " + count);
        }
        if (count > 0) {
            store.addItemsScraped(runId, count, clock.instant());
        }
    }

    /**
     * Liveness signal keeping a long step from being recovered as stale.
     */
    public void touch(String runId) {
        store.touch(runId, clock.instant());
    }

    public Optional<Run> run(String runId) {
        return store.findRun(runId);
    }

    public List<Run> listRuns(String fleetName, int limit) {
        return store.listRuns(fleetName, limit);
    }

    public List<Step> steps(String runId) {
        return store.findSteps(runId);
    }

    private Run requireRun(String runId) {
        return store.findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private Run lockRun(String runId) {
        return store.findRunForUpdate(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    private Step requireStep(String runId, int stepNumber) {
        return store.findStep(runId, stepNumber).orElseThrow(() ->
                new IllegalArgumentException("Run " + runId + " has no step " + stepNumber));
    }

    private static void checkDefinitions(List<StepDefinition> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("a pipeline needs at least one step");
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).number() != i) {
                throw new IllegalArgumentException("step numbers must be 0.." + (steps.size() - 1)
                        + " in order, found " + steps.get(i).number() + " at position " + i);
            }
        }
    }
}
