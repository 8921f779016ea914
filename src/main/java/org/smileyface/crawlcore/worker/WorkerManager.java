package org.smileyface.crawlcore.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.crawlcore.model.StepKind;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the pool of {@link CrawlWorker}s draining one step of one run.
 * Provides APIs to start, stop, await and query statuses of the workers.
 */
public class WorkerManager {

    private static final Logger log = LogManager.getLogger();

    private final List<CrawlWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final WorkerServices services;
    private ExecutorService executor;
    private String label = "idle";

    public WorkerManager(WorkerServices services) {
        this.services = Objects.requireNonNull(services, "services");
    }

    public synchronized void start(StepAssignment assignment) {
        if (running.get()) {
            throw new IllegalStateException("WorkerManager already running " + label);
        }
        Objects.requireNonNull(assignment, "assignment");
        int n = Math.max(1, assignment.settings().workerCount());
        label = assignment.runId() + "/" + assignment.stepNumber();
        workers.clear();
        futures.clear();

        AtomicInteger seq = new AtomicInteger();
        String threadPrefix = "worker-" + assignment.runId().substring(0, Math.min(8, assignment.runId().length()))
                + "-s" + assignment.stepNumber() + "-";
        executor = Executors.newFixedThreadPool(n, r -> new Thread(r, threadPrefix + seq.incrementAndGet()));
        for (int i = 0; i < n; i++) {
            String id = "worker-" + UUID.randomUUID();
            CrawlWorker w = assignment.step().kind() == StepKind.FRONTIER
                    ? new FrontierWorker(id, assignment, services)
                    : new QueueWorker(id, assignment, services);
            // a fatal failure ends the step for every peer
            w.onFatal(this::requestStop);
            workers.add(w);
            futures.add(executor.submit(w));
        }
        running.set(true);
        log.info("WorkerManager STARTED {} with {} {} workers", label, n, assignment.step().kind());
    }

    /**
     * Asks every worker to stop after its current item and waits for them to exit.
     */
    public synchronized void stopAll() {
        for (CrawlWorker w : workers) {
            w.stop();
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.warn("Worker task of {} ended abnormally: {}", label, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            }
        }
        shutdown();
        logAggregate("STOPPED");
    }

    /**
     * Signals the workers to stop without waiting for them.
     */
    public void requestStop() {
        for (CrawlWorker w : workers) {
            w.stop();
        }
    }

    public List<WorkerStatus> getStatuses() {
        List<WorkerStatus> list = new ArrayList<>(workers.size());
        for (CrawlWorker w : workers) {
            list.add(w.getStatus());
        }
        return list;
    }

    public boolean isRunning() {
        if (!running.get()) return false;
        for (Future<?> f : futures) {
            if (!f.isDone()) return true;
        }
        return false;
    }

    /**
     * @return the first fatal failure reported by a worker, or null
     */
    public FatalRunException fatalError() {
        for (CrawlWorker w : workers) {
            if (w.getFatalError() != null) return w.getFatalError();
        }
        return null;
    }

    /**
     * Wait until all workers exit or the timeout elapses.
     * @return true if all workers finished before timeout, false otherwise.
     */
    public boolean awaitAll(Duration timeout) {
        long remainingMs = timeout == null ? Long.MAX_VALUE : Math.max(0, timeout.toMillis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline - System.nanoTime();
            if (nanosLeft <= 0) return false;
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (ExecutionException e) {
                // the worker's status already reflects ERROR
                log.debug("Worker task of {} failed: {}", label, e.getMessage());
            }
        }
        shutdown();
        logAggregate("ALL FINISHED");
        return true;
    }

    private void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        running.set(false);
    }

    public long totalProcessed() {
        long total = 0;
        for (WorkerStatus s : getStatuses()) {
            total += s.getProcessedCount();
        }
        return total;
    }

    public long totalFailed() {
        long total = 0;
        for (WorkerStatus s : getStatuses()) {
            total += s.getFailedCount();
        }
        return total;
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        List<WorkerStatus> statuses = getStatuses();
        for (WorkerStatus s : statuses) {
            processed += s.getProcessedCount();
            WorkerState st = s.getState();
            if (st == WorkerState.COMPLETED) completed++;
            else if (st == WorkerState.STOPPED) stopped++;
            else if (st == WorkerState.ERROR) error++;
        }
        log.info("WorkerManager {} {}: workers -> completed={}, stopped={}, error={}, totalProcessed={} (workers={})",
                label, event, completed, stopped, error, processed, statuses.size());
    }
}
