package org.smileyface.crawlcore.pipeline;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.checkpoint.NoResumableRunException;
import org.smileyface.crawlcore.checkpoint.RunContext;
import org.smileyface.crawlcore.config.FleetSettings;
import org.smileyface.crawlcore.config.OrchestratorProperties;
import org.smileyface.crawlcore.model.FrontierProgress;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.model.StepKind;
import org.smileyface.crawlcore.model.StepMetrics;
import org.smileyface.crawlcore.queue.WorkItemRequest;
import org.smileyface.crawlcore.worker.FatalRunException;
import org.smileyface.crawlcore.worker.HeartbeatScheduler;
import org.smileyface.crawlcore.worker.StepAssignment;
import org.smileyface.crawlcore.worker.WorkerManager;
import org.smileyface.crawlcore.worker.WorkerServices;
import org.smileyface.crawlcore.worker.WorkerStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives runs: picks the resume point, walks the remaining steps in order, seeds each one,
 * drains it with a {@link WorkerManager} and records the checkpoint. A run halts on the first
 * fatal failure or failed step that does not continue on error, and stops cooperatively when
 * its stop flag is set.
 */
@Component
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final PipelineRegistry registry;
    private final OrchestratorProperties properties;
    private final CheckpointManager checkpoints;
    private final WorkerServices services;
    private final Map<String, WorkerManager> activeSteps = new ConcurrentHashMap<>();
    private final ExecutorService drivers;

    public PipelineRunner(PipelineRegistry registry, OrchestratorProperties properties,
                          CheckpointManager checkpoints, WorkerServices services) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
        this.services = Objects.requireNonNull(services, "services");
        AtomicInteger seq = new AtomicInteger();
        this.drivers = Executors.newCachedThreadPool(r -> new Thread(r, "run-driver-" + seq.incrementAndGet()));
    }

    /**
     * Runs the fleet to a terminal state on the calling thread. A resume request for a fleet
     * without a resumable run starts a fresh one.
     *
     * @throws IllegalArgumentException for an unknown fleet
     */
    public RunOutcome run(String fleetName, boolean fresh) {
        FleetPipeline pipeline = registry.require(fleetName);
        RunContext ctx = init(pipeline, fresh);
        return execute(ctx, pipeline);
    }

    /**
     * Creates or resumes the run synchronously and drives it on a background thread.
     *
     * @return the run being driven
     */
    public RunContext start(String fleetName, boolean fresh) {
        FleetPipeline pipeline = registry.require(fleetName);
        RunContext ctx = init(pipeline, fresh);
        drivers.submit(() -> execute(ctx, pipeline));
        return ctx;
    }

    /**
     * Sets the run's stop flag and signals local workers. Workers finish their current item first.
     *
     * @return false when the run is unknown or already terminal
     */
    public boolean stop(String runId) {
        boolean requested = checkpoints.requestStop(runId);
        WorkerManager manager = activeSteps.get(runId);
        if (requested && manager != null) {
            manager.requestStop();
        }
        return requested;
    }

    public boolean isDriving(String runId) {
        return activeSteps.containsKey(runId);
    }

    /**
     * Worker statuses of the step this process is currently draining for the run.
     */
    public List<WorkerStatus> workerStatuses(String runId) {
        WorkerManager manager = activeSteps.get(runId);
        return manager == null ? List.of() : manager.getStatuses();
    }

    @PreDestroy
    public void shutdown() {
        activeSteps.values().forEach(WorkerManager::requestStop);
        drivers.shutdown();
    }

    private RunContext init(FleetPipeline pipeline, boolean fresh) {
        try {
            return checkpoints.initRun(pipeline.fleetName(), fresh, pipeline.steps());
        } catch (NoResumableRunException e) {
            log.info("No resumable run for fleet {}, starting a fresh one", pipeline.fleetName());
            return checkpoints.initRun(pipeline.fleetName(), true, pipeline.steps());
        }
    }

    RunOutcome execute(RunContext ctx, FleetPipeline pipeline) {
        String runId = ctx.getRunId();
        FleetSettings settings = properties.resolve(ctx.getFleetName());
        log.info("Driving {} from step {}", ctx, ctx.getStartStep());
        try (HeartbeatScheduler.Handle ignored = services.heartbeats().schedule(
                () -> checkpoints.touch(runId), settings.heartbeatInterval())) {
            for (int n = ctx.getStartStep(); n < ctx.getSteps().size(); n++) {
                if (checkpoints.isStopRequested(runId)) {
                    log.info("Run {} stopping before step {}", runId, n);
                    break;
                }
                StepResult result = runStep(ctx, pipeline, settings, ctx.step(n));
                if (result != StepResult.ADVANCE) {
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("Run {} driver failed: {}", runId, e.getMessage(), e);
            haltOnError(runId, e);
        }
        Run run = checkpoints.finalizeRun(runId);
        return RunOutcome.of(run);
    }

    private void haltOnError(String runId, RuntimeException e) {
        Integer current = checkpoints.run(runId).map(Run::getCurrentStep).orElse(null);
        if (current == null) return;
        try {
            checkpoints.markStepFailed(runId, current, StepMetrics.EMPTY, e.getMessage(), false);
        } catch (RuntimeException inner) {
            log.error("Run {} could not record the failure of step {}: {}", runId, current, inner.getMessage(), inner);
            e.addSuppressed(inner);
        }
    }

    private enum StepResult { ADVANCE, HALTED, STOPPED }

    private StepResult runStep(RunContext ctx, FleetPipeline pipeline, FleetSettings settings, StepDefinition step) {
        String runId = ctx.getRunId();
        checkpoints.markStepStart(runId, step.number());
        long seeded = seed(ctx, pipeline, settings, step);

        WorkerManager manager = new WorkerManager(services);
        activeSteps.put(runId, manager);
        boolean finished;
        try {
            manager.start(new StepAssignment(runId, step, settings, pipeline.fetcher(), pipeline.egress(), pipeline.processManager()));
            finished = manager.awaitAll(settings.awaitTimeout());
            if (!finished) {
                log.warn("Run {} step {} did not drain within {}, stopping its workers", runId, step.number(), settings.awaitTimeout());
                manager.stopAll();
            }
        } finally {
            activeSteps.remove(runId, manager);
        }

        StepMetrics metrics = metrics(runId, step, seeded);
        FatalRunException fatal = manager.fatalError();
        if (fatal != null) {
            checkpoints.markStepFailed(runId, step.number(), metrics, fatal.getMessage(), false);
            return StepResult.HALTED;
        }
        if (checkpoints.isStopRequested(runId)) {
            // left in progress so a resume picks it up again
            log.info("Run {} stopped during step {} ({})", runId, step.number(), step.name());
            return StepResult.STOPPED;
        }
        if (!isDrained(runId, step)) {
            String error = finished
                    ? "step " + step.name() + " ended with work remaining: " + firstWorkerError(manager)
                    : "step " + step.name() + " did not drain within " + settings.awaitTimeout();
            boolean halted = checkpoints.markStepFailed(runId, step.number(), metrics, error, step.continueOnError());
            return halted ? StepResult.HALTED : StepResult.ADVANCE;
        }
        checkpoints.markStepComplete(runId, step.number(), metrics);
        return StepResult.ADVANCE;
    }

    private long seed(RunContext ctx, FleetPipeline pipeline, FleetSettings settings, StepDefinition step) {
        String runId = ctx.getRunId();
        List<Seed> seeds = pipeline.targetResolver().seeds(runId, step);
        if (seeds == null) seeds = List.of();
        long added;
        if (step.kind() == StepKind.FRONTIER) {
            services.frontier().configure(runId, settings.frontier());
            if (ctx.isResumed()) {
                services.frontier().requeueInFlight(runId);
            }
            added = 0;
            for (Seed s : seeds) {
                if (services.frontier().add(runId, s.key(), s.priority(), 0, null)) added++;
            }
        } else {
            List<WorkItemRequest> requests = new ArrayList<>(seeds.size());
            for (Seed s : seeds) {
                requests.add(new WorkItemRequest(runId, step.number(), s.key(), s.payload(), s.priority(), settings.maxAttempts()));
            }
            added = services.queue().enqueueAll(requests);
        }
        log.info("Run {} step {} ({}) seeded {} new of {} targets", runId, step.number(), step.name(), added, seeds.size());
        return added;
    }

    private boolean isDrained(String runId, StepDefinition step) {
        return step.kind() == StepKind.FRONTIER
                ? services.frontier().progress(runId).isDrained()
                : services.queue().depth(runId, step.number()).isDrained();
    }

    private StepMetrics metrics(String runId, StepDefinition step, long seeded) {
        if (step.kind() == StepKind.FRONTIER) {
            FrontierProgress p = services.frontier().progress(runId);
            return new StepMetrics(p.total(), p.completed(), seeded, 0, p.failed() + p.rejected());
        }
        QueueDepth d = services.queue().depth(runId, step.number());
        return new StepMetrics(d.total(), d.completed(), seeded, 0, d.dead());
    }

    private static String firstWorkerError(WorkerManager manager) {
        for (WorkerStatus s : manager.getStatuses()) {
            if (s.getLastError() != null) return s.getLastError();
        }
        return "no worker error recorded";
    }
}
