package org.smileyface.crawlcore.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.frontier.BackoffPolicy;
import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.model.ProxyEndpoint;
import org.smileyface.crawlcore.resource.ProcessManager;
import org.smileyface.crawlcore.resource.TrackedResource;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A worker draining one pipeline step. It repeatedly takes a batch of targets, fetches each one
 * through an egress endpoint and, where the fleet needs one, a tracked rendering process, and
 * reports the outcome back. It stops when the step's backlog is drained, when {@link #stop()} is
 * called or the run's stop flag is set (checked between targets), or on a fatal fetch failure.
 */
public abstract class CrawlWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);

    protected final String id;
    protected final StepAssignment assignment;
    protected final WorkerServices services;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    private volatile WorkerState state = WorkerState.NEW;
    private volatile String lastTarget;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile FatalRunException fatalError;
    private volatile Runnable fatalListener;

    // only touched by the worker thread
    private TrackedResource browser;

    protected CrawlWorker(String id, StepAssignment assignment, WorkerServices services) {
        this.id = Objects.requireNonNull(id, "id");
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.services = Objects.requireNonNull(services, "services");
    }

    /**
     * Takes and processes one batch.
     *
     * @return false when nothing was available to take
     */
    protected abstract boolean processBatch() throws InterruptedException;

    /**
     * @return true when the step has nothing left that any worker could still take
     */
    protected abstract boolean isDrained();

    public String getId() {
        return id;
    }

    public void stop() {
        stopRequested.set(true);
        if (state == WorkerState.NEW) {
            transitionTo(WorkerState.STOPPED, null);
        }
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(id, state, processedCount.get(), failedCount.get(), lastTarget, lastError, startedAt, finishedAt);
    }

    public FatalRunException getFatalError() {
        return fatalError;
    }

    /**
     * Called on the worker thread after a fatal failure, before the worker exits.
     */
    public void onFatal(Runnable listener) {
        this.fatalListener = listener;
    }

    @Override
    public void run() {
        if (state == WorkerState.STOPPED) return;
        transitionTo(WorkerState.RUNNING, null);
        try {
            for (;;) {
                if (shouldStop()) {
                    transitionTo(WorkerState.STOPPED, null);
                    return;
                }
                if (!processBatch()) {
                    if (isDrained()) {
                        transitionTo(WorkerState.COMPLETED, null);
                        return;
                    }
                    // backlog held by other workers or backing off
                    Thread.sleep(assignment.settings().idleBackoff().toMillis());
                }
            }
        } catch (FatalRunException e) {
            fatalError = e;
            lastError = e.getMessage();
            transitionTo(WorkerState.ERROR, null);
            Runnable listener = fatalListener;
            if (listener != null) {
                listener.run();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(WorkerState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(WorkerState.ERROR, t);
        } finally {
            discardBrowser(null);
        }
    }

    /**
     * True once this worker or the run has been asked to stop.
     */
    protected boolean shouldStop() {
        if (stopRequested.get()) return true;
        if (services.checkpoints().isStopRequested(assignment.runId())) {
            stopRequested.set(true);
            return true;
        }
        return false;
    }

    protected void recordProcessed(String target) {
        lastTarget = target;
        processedCount.incrementAndGet();
        services.checkpoints().addItemsScraped(assignment.runId(), 1);
    }

    protected void recordFailed(String target, String error) {
        lastTarget = target;
        lastError = error;
        failedCount.incrementAndGet();
    }

    /**
     * Fetches the target, retrying transient and blocked failures locally with the step's backoff.
     * Only the final outcome is returned.
     */
    protected FetchOutcome fetchWithRetries(FetchTarget target) throws InterruptedException {
        int retries = Math.max(0, assignment.settings().localRetries());
        BackoffPolicy backoff = assignment.settings().frontier().backoff();
        String stickyKey = assignment.runId() + ":" + id;
        for (int attempt = 0; ; attempt++) {
            FetchOutcome outcome = attempt(target, stickyKey);
            if (outcome.isSuccess() || !isRetryable(outcome.getFailure()) || attempt >= retries || stopRequested.get()) {
                return outcome;
            }
            if (outcome.getFailure() == FailureKind.BLOCKED) {
                // next attempt goes out through a different identity
                services.proxies().unbind(stickyKey);
            }
            Duration delay = backoff.delay(attempt + 1);
            log.debug("Worker {} retrying {} in {} ms after {}", id, target.key(), delay.toMillis(), outcome);
            Thread.sleep(delay.toMillis());
        }
    }

    private static boolean isRetryable(FailureKind kind) {
        return kind == FailureKind.TRANSIENT || kind == FailureKind.BLOCKED;
    }

    private FetchOutcome attempt(FetchTarget target, String stickyKey) throws InterruptedException {
        ProxyEndpoint proxy = null;
        if (assignment.egress() != null) {
            Optional<ProxyEndpoint> acquired = acquireEgress(stickyKey);
            if (acquired.isEmpty()) {
                return FetchOutcome.failure(FailureKind.TRANSIENT, "no egress endpoint available for " + assignment.egress());
            }
            proxy = acquired.get();
        }

        BrowserInstance instance;
        try {
            instance = browserInstance();
        } catch (IOException e) {
            return FetchOutcome.failure(FailureKind.RESOURCE, "cannot start browser: " + e.getMessage());
        }

        long started = services.clock().millis();
        FetchOutcome outcome;
        try {
            outcome = assignment.fetcher().fetch(target, proxy, instance);
            if (outcome == null) {
                outcome = FetchOutcome.failure(FailureKind.TRANSIENT, "fetcher returned no outcome");
            }
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            outcome = FetchOutcome.failure(FailureKind.TRANSIENT, msg);
        }
        long latency = Math.max(0, services.clock().millis() - started);

        if (proxy != null) {
            reportEgress(proxy, outcome, latency);
        }
        if (!outcome.isSuccess() && outcome.getFailure() == FailureKind.RESOURCE) {
            discardBrowser(BrowserInstance.REASON_CRASH);
        }
        return outcome;
    }

    /**
     * An empty pool is backpressure: idle and ask again, for at most one heartbeat expiry.
     */
    private Optional<ProxyEndpoint> acquireEgress(String stickyKey) throws InterruptedException {
        EgressRequirement egress = assignment.egress();
        long deadline = services.clock().millis() + assignment.settings().heartbeatExpiry().toMillis();
        for (;;) {
            Optional<ProxyEndpoint> endpoint = services.proxies().acquire(egress.countryCode(), egress.type(), stickyKey);
            if (endpoint.isPresent() || stopRequested.get() || services.clock().millis() >= deadline) {
                return endpoint;
            }
            Thread.sleep(assignment.settings().idleBackoff().toMillis());
        }
    }

    private void reportEgress(ProxyEndpoint proxy, FetchOutcome outcome, long latencyMs) {
        if (outcome.isSuccess()) {
            services.proxies().reportOutcome(proxy.getEndpointId(), true, latencyMs);
            return;
        }
        switch (outcome.getFailure()) {
            // the endpoint delivered a response; the content was the problem
            case STRUCTURAL -> services.proxies().reportOutcome(proxy.getEndpointId(), true, latencyMs);
            case TRANSIENT, BLOCKED -> services.proxies().reportOutcome(proxy.getEndpointId(), false, latencyMs);
            default -> {}
        }
    }

    private BrowserInstance browserInstance() throws IOException {
        ProcessManager pm = assignment.processManager();
        if (pm == null) return null;
        if (browser == null) {
            long pid = pm.spawn(assignment.runId(), assignment.stepNumber());
            browser = services.resources().track(assignment.runId(), assignment.stepNumber(), pid, pm.parentProcessId());
            log.debug("Worker {} started browser pid={}", id, pid);
        }
        return browser.getInstance();
    }

    /**
     * Terminates the current browser, if any. A null reason records a normal completion.
     */
    private void discardBrowser(String abnormalReason) {
        TrackedResource current = browser;
        if (current == null) return;
        browser = null;
        try {
            if (abnormalReason != null) {
                current.markAbnormal(abnormalReason);
            }
            assignment.processManager().kill(current.getProcessId());
        } catch (RuntimeException e) {
            log.warn("Worker {} could not kill browser pid={}: {}", id, current.getProcessId(), e.getMessage());
        } finally {
            current.close();
        }
    }

    /**
     * Centralized state transition with structured logging; terminal states carry the duration.
     */
    private void transitionTo(WorkerState newState, Throwable error) {
        WorkerState old = this.state;
        Instant now = services.clock().instant();
        if (newState == WorkerState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = now;
            }
            this.state = WorkerState.RUNNING;
            log.info("Worker {} state {} -> {} (run={}, step={})", id, old, this.state, assignment.runId(), assignment.stepNumber());
            return;
        }

        this.finishedAt = now;
        this.state = newState;
        long dur = startedAt != null ? Math.max(0, Duration.between(startedAt, finishedAt).toMillis()) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Worker {} state {} -> STOPPED after {} ms (processed={}, lastTarget={})", id, old, dur, count, lastTarget);
            case COMPLETED -> log.info("Worker {} state {} -> COMPLETED after {} ms (processed={}, failed={})", id, old, dur, count, failedCount.get());
            case ERROR -> {
                if (error != null) {
                    log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastTarget={}, error={})", id, old, dur, count, lastTarget, lastError, error);
                } else {
                    log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastTarget={}, error={})", id, old, dur, count, lastTarget, lastError);
                }
            }
            default -> log.info("Worker {} state {} -> {}", id, old, newState);
        }
    }
}
