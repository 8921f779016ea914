package org.smileyface.crawlcore.worker;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.crawlcore.checkpoint.CheckpointManager;
import org.smileyface.crawlcore.checkpoint.InMemoryRunStore;
import org.smileyface.crawlcore.config.FleetSettings;
import org.smileyface.crawlcore.config.OrchestratorProperties;
import org.smileyface.crawlcore.frontier.InMemoryCrawlFrontier;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.proxy.InMemoryProxyPool;
import org.smileyface.crawlcore.queue.InMemoryWorkQueue;
import org.smileyface.crawlcore.queue.WorkItemRequest;
import org.smileyface.crawlcore.resource.InMemoryResourceTracker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkerManagerTest {

    private static final StepDefinition STEP = StepDefinition.queue(0, "products");

    private final Clock clock = Clock.systemUTC();
    private InMemoryWorkQueue queue;
    private CheckpointManager checkpoints;
    private HeartbeatScheduler heartbeats;
    private WorkerServices services;
    private FleetSettings settings;
    private String runId;

    @BeforeEach
    void setUp() {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getWorkers().setCount(3);
        properties.getWorkers().setIdleBackoff(Duration.ofMillis(10));
        properties.getWorkers().setLocalRetries(0);
        properties.getQueue().setClaimBatchSize(5);
        settings = properties.resolve(null);

        queue = new InMemoryWorkQueue(clock, 3, Duration.ofMinutes(2));
        checkpoints = new CheckpointManager(new InMemoryRunStore(), clock);
        heartbeats = new HeartbeatScheduler(1);
        services = new WorkerServices(queue,
                new InMemoryCrawlFrontier(clock, settings.frontier()),
                new InMemoryProxyPool(clock, properties.proxyHealthPolicy()),
                new InMemoryResourceTracker(clock),
                checkpoints, heartbeats, clock);
        runId = checkpoints.initRun("catalog", true, List.of(STEP)).getRunId();
    }

    @AfterEach
    void tearDown() {
        heartbeats.shutdown();
    }

    private void enqueue(String prefix, int n, int priority) {
        List<WorkItemRequest> requests = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            requests.add(new WorkItemRequest(runId, STEP.number(), prefix + i, null, priority, 3));
        }
        queue.enqueueAll(requests);
    }

    private StepAssignment assignment(Fetcher fetcher) {
        return new StepAssignment(runId, STEP, settings, fetcher, null, null);
    }

    @Test
    void workersDrainTheStepAndComplete() {
        enqueue("sku-", 12, 0);
        WorkerManager mgr = new WorkerManager(services);

        mgr.start(assignment((target, proxy, browser) -> FetchOutcome.success(new byte[0])));
        assertThat(mgr.awaitAll(Duration.ofSeconds(10))).isTrue();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(mgr.getStatuses()).hasSize(3)
                .allSatisfy(s -> assertThat(s.getState()).isEqualTo(WorkerState.COMPLETED));
        assertThat(mgr.totalProcessed()).isEqualTo(12);
        assertThat(mgr.totalFailed()).isZero();
        assertThat(mgr.fatalError()).isNull();
        assertThat(queue.depth(runId, STEP.number()).completed()).isEqualTo(12);
        assertThat(checkpoints.run(runId).orElseThrow().getItemsScraped()).isEqualTo(12L);
    }

    @Test
    void startingTwiceIsRejected() {
        enqueue("sku-", 3, 0);
        WorkerManager mgr = new WorkerManager(services);
        mgr.start(assignment((target, proxy, browser) -> FetchOutcome.success(new byte[0])));
        try {
            assertThatThrownBy(() -> mgr.start(assignment((target, proxy, browser) -> FetchOutcome.success(new byte[0]))))
                    .isInstanceOf(IllegalStateException.class);
        } finally {
            mgr.awaitAll(Duration.ofSeconds(10));
        }
    }

    @Test
    void fatalFailureStopsEveryWorkerAndReleasesClaims() {
        enqueue("poison-", 1, 10);
        enqueue("sku-", 30, 0);
        WorkerManager mgr = new WorkerManager(services);

        mgr.start(assignment((target, proxy, browser) -> {
            if (target.key().startsWith("poison")) {
                return FetchOutcome.failure(FailureKind.FATAL, "login expired");
            }
            Thread.sleep(20);
            return FetchOutcome.success(new byte[0]);
        }));
        assertThat(mgr.awaitAll(Duration.ofSeconds(10))).isTrue();

        assertThat(mgr.fatalError()).isNotNull();
        assertThat(mgr.fatalError().getMessage()).contains("poison-0").contains("login expired");
        assertThat(mgr.getStatuses()).anyMatch(s -> s.getState() == WorkerState.ERROR);
        assertThat(mgr.getStatuses()).noneMatch(s -> s.getState() == WorkerState.RUNNING);

        QueueDepth depth = queue.depth(runId, STEP.number());
        assertThat(depth.claimed()).isZero();
        assertThat(depth.completed()).isLessThan(30);
        assertThat(depth.pending() + depth.completed()).isEqualTo(31);
    }

    @Test
    void stopAllLetsWorkersFinishTheirItemAndReturnsTheRest() throws Exception {
        enqueue("sku-", 40, 0);
        WorkerManager mgr = new WorkerManager(services);

        mgr.start(assignment((target, proxy, browser) -> {
            Thread.sleep(20);
            return FetchOutcome.success(new byte[0]);
        }));
        Thread.sleep(60);
        mgr.stopAll();

        assertThat(mgr.isRunning()).isFalse();
        assertThat(mgr.getStatuses()).allSatisfy(s -> assertThat(s.getState()).isEqualTo(WorkerState.STOPPED));
        QueueDepth depth = queue.depth(runId, STEP.number());
        assertThat(depth.claimed()).isZero();
        assertThat(depth.failed()).isZero();
        assertThat(depth.pending() + depth.completed()).isEqualTo(40);
        assertThat(depth.completed()).isEqualTo(mgr.totalProcessed());
    }
}
