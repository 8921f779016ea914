package org.smileyface.crawlcore.checkpoint;

import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.model.Step;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Single-process {@link RunStore}. One monitor guards every map, so {@link #inTransaction}
 * simply holds it for the duration of the work.
 */
public class InMemoryRunStore implements RunStore {

    static final Comparator<Run> RESUME_ORDER = Comparator
            .comparing(Run::getItemsScraped, Comparator.nullsLast(Comparator.<Long>reverseOrder()))
            .thenComparing(Run::getStartedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Map<String, Run> runs = new LinkedHashMap<>();
    private final Map<String, TreeMap<Integer, Step>> steps = new LinkedHashMap<>();

    @Override
    public synchronized void insertRun(Run run, List<Step> runSteps) {
        if (runs.containsKey(run.getRunId())) {
            throw new IllegalArgumentException("Run already exists: " + run.getRunId());
        }
        runs.put(run.getRunId(), new Run(run));
        TreeMap<Integer, Step> byNumber = new TreeMap<>();
        for (Step s : runSteps) {
            byNumber.put(s.getStepNumber(), new Step(s));
        }
        steps.put(run.getRunId(), byNumber);
    }

    @Override
    public synchronized Optional<Run> findRun(String runId) {
        Run r = runs.get(runId);
        return r == null ? Optional.empty() : Optional.of(new Run(r));
    }

    @Override
    public Optional<Run> findRunForUpdate(String runId) {
        return findRun(runId);
    }

    @Override
    public synchronized Optional<Run> findResumable(String fleetName) {
        return runs.values().stream()
                .filter(r -> r.getFleetName().equals(fleetName))
                .filter(r -> r.getStatus() != null && r.getStatus().isResumable())
                .min(RESUME_ORDER)
                .map(Run::new);
    }

    @Override
    public synchronized List<Run> listRuns(String fleetName, int limit) {
        return runs.values().stream()
                .filter(r -> fleetName == null || r.getFleetName().equals(fleetName))
                .sorted(Comparator.comparing(Run::getStartedAt).reversed())
                .limit(Math.max(0, limit))
                .map(Run::new)
                .toList();
    }

    @Override
    public synchronized List<Run> findByStatus(RunStatus status) {
        return runs.values().stream()
                .filter(r -> r.getStatus() == status)
                .map(Run::new)
                .toList();
    }

    @Override
    public synchronized void updateRun(Run run) {
        if (!runs.containsKey(run.getRunId())) {
            throw new RunNotFoundException(run.getRunId());
        }
        runs.put(run.getRunId(), new Run(run));
    }

    @Override
    public synchronized List<Step> findSteps(String runId) {
        TreeMap<Integer, Step> byNumber = steps.get(runId);
        if (byNumber == null) return List.of();
        List<Step> out = new ArrayList<>(byNumber.size());
        for (Step s : byNumber.values()) {
            out.add(new Step(s));
        }
        return out;
    }

    @Override
    public synchronized Optional<Step> findStep(String runId, int stepNumber) {
        TreeMap<Integer, Step> byNumber = steps.get(runId);
        Step s = byNumber == null ? null : byNumber.get(stepNumber);
        return s == null ? Optional.empty() : Optional.of(new Step(s));
    }

    @Override
    public synchronized void updateStep(Step step) {
        TreeMap<Integer, Step> byNumber = steps.get(step.getRunId());
        if (byNumber == null || !byNumber.containsKey(step.getStepNumber())) {
            throw new IllegalArgumentException("Unknown step " + step.getStepNumber() + " of run " + step.getRunId());
        }
        byNumber.put(step.getStepNumber(), new Step(step));
    }

    @Override
    public synchronized boolean stopIfIdleSince(String runId, Instant cutoff, Instant now) {
        Run r = runs.get(runId);
        if (r == null || r.getStatus() != RunStatus.RUNNING) return false;
        if (r.getUpdatedAt() != null && !r.getUpdatedAt().isBefore(cutoff)) return false;
        r.setStatus(RunStatus.STOPPED);
        r.setErrorMessage("Recovered as stale: no update since " + r.getUpdatedAt());
        r.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean setStopRequested(String runId, boolean requested, Instant now) {
        Run r = runs.get(runId);
        if (r == null) return false;
        r.setStopRequested(requested);
        r.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized void addItemsScraped(String runId, long delta, Instant now) {
        Run r = runs.get(runId);
        if (r == null) throw new RunNotFoundException(runId);
        long current = r.getItemsScraped() == null ? 0L : r.getItemsScraped();
        r.setItemsScraped(current + delta);
        r.setUpdatedAt(now);
    }

    @Override
    public synchronized void touch(String runId, Instant now) {
        Run r = runs.get(runId);
        if (r == null) throw new RunNotFoundException(runId);
        r.setUpdatedAt(now);
    }

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        return work.get();
    }
}
