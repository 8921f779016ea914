package org.smileyface.crawlcore.queue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.smileyface.crawlcore.model.QueueDepth;
import org.smileyface.crawlcore.model.WorkItem;
import org.smileyface.crawlcore.model.WorkItemStatus;
import org.smileyface.crawlcore.testutil.MutableClock;
import org.smileyface.crawlcore.testutil.PostgresTestContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract tests for WorkQueue implementations: the in-memory queue always, the PostgreSQL
 * queue when Docker is available.
 */
class WorkQueueParameterizedTest {

    private static final Logger logger = LogManager.getLogger(WorkQueueParameterizedTest.class);
    private static final Duration EXPIRY = Duration.ofMinutes(2);
    private static List<Arguments> IMPLEMENTATIONS;

    static Stream<Arguments> queueImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (WorkQueueParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of("InMemoryWorkQueue",
                            (Function<MutableClock, WorkQueue>) clock -> new InMemoryWorkQueue(clock, 3, EXPIRY)));
                    try {
                        PostgresTestContainer.start();
                        IMPLEMENTATIONS.add(Arguments.of("JdbcWorkQueue",
                                (Function<MutableClock, WorkQueue>) clock -> new JdbcWorkQueue(
                                        PostgresTestContainer.jdbcTemplate(), PostgresTestContainer.transactionTemplate(),
                                        clock, 3, EXPIRY)));
                    } catch (Throwable t) {
                        logger.error("Failed to start PostgreSQL Testcontainer: {}", t.getMessage(), t);
                        // Docker not available, skip the JDBC implementation
                    }
                }
            }
        }
        return IMPLEMENTATIONS.stream();
    }

    @AfterAll
    static void tearDown() {
        PostgresTestContainer.stop();
        IMPLEMENTATIONS = null;
    }

    private static String newRun() {
        return UUID.randomUUID().toString();
    }

    private static ClaimScope scope(String runId) {
        return ClaimScope.step(runId, 0, EXPIRY);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("enqueueIsIdempotentPerNaturalKey")
    void enqueueIsIdempotentPerNaturalKey(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();

        assertThat(q.enqueue(run, "sku-1", bytes("a"), 1)).isTrue();
        assertThat(q.enqueue(run, "sku-1", bytes("b"), 5)).isFalse();
        // same key in another run is a different item
        assertThat(q.enqueue(newRun(), "sku-1", bytes("a"), 1)).isTrue();

        assertThat(q.depth(run).total()).isEqualTo(1);
        List<WorkItem> claimed = q.claimNext(scope(run), "w1", 10);
        assertThat(claimed).hasSize(1);
        assertThat(claimed.get(0).getPayload()).isEqualTo(bytes("a"));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("enqueueAllCountsOnlyNewItems")
    void enqueueAllCountsOnlyNewItems(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        q.enqueue(new WorkItemRequest(run, 0, "k1", null, 0, 3));

        int inserted = q.enqueueAll(List.of(
                new WorkItemRequest(run, 0, "k1", null, 0, 3),
                new WorkItemRequest(run, 0, "k2", null, 0, 3),
                new WorkItemRequest(run, 1, "k3", null, 0, 3)));

        assertThat(inserted).isEqualTo(2);
        assertThat(q.depth(run, 0).pending()).isEqualTo(2);
        assertThat(q.depth(run, 1).pending()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("claimOrderIsPriorityThenAge")
    void claimOrderIsPriorityThenAge(String implName, Function<MutableClock, WorkQueue> factory) {
        MutableClock clock = new MutableClock();
        WorkQueue q = factory.apply(clock);
        String run = newRun();
        q.enqueue(run, "low-old", null, 1);
        clock.advance(Duration.ofSeconds(1));
        q.enqueue(run, "high", null, 5);
        clock.advance(Duration.ofSeconds(1));
        q.enqueue(run, "low-new", null, 1);

        List<WorkItem> first = q.claimNext(scope(run), "w1", 2);
        List<WorkItem> second = q.claimNext(scope(run), "w2", 2);

        assertThat(first).extracting(WorkItem::getNaturalKey).containsExactly("high", "low-old");
        assertThat(second).extracting(WorkItem::getNaturalKey).containsExactly("low-new");
        assertThat(first).allSatisfy(i -> {
            assertThat(i.getStatus()).isEqualTo(WorkItemStatus.CLAIMED);
            assertThat(i.getClaimedBy()).isEqualTo("w1");
            assertThat(i.getAttemptCount()).isEqualTo(1);
        });
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("claimScopeLimitsRunAndStep")
    void claimScopeLimitsRunAndStep(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        String other = newRun();
        q.enqueue(new WorkItemRequest(run, 0, "step0", null, 0, 3));
        q.enqueue(new WorkItemRequest(run, 1, "step1", null, 0, 3));
        q.enqueue(new WorkItemRequest(other, 1, "other", null, 0, 3));

        List<WorkItem> claimed = q.claimNext(ClaimScope.step(run, 1, EXPIRY), "w1", 10);

        assertThat(claimed).extracting(WorkItem::getNaturalKey).containsExactly("step1");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("liveClaimIsNotReclaimedButStaleClaimIs")
    void liveClaimIsNotReclaimedButStaleClaimIs(String implName, Function<MutableClock, WorkQueue> factory) {
        MutableClock clock = new MutableClock();
        WorkQueue q = factory.apply(clock);
        String run = newRun();
        q.enqueue(run, "page-1", null, 0);
        long id = q.claimNext(scope(run), "w1", 1).get(0).getItemId();

        clock.advance(Duration.ofMinutes(1));
        assertThat(q.heartbeat(id, "w1")).isEqualTo(HeartbeatResult.RENEWED);
        clock.advance(Duration.ofMinutes(1));
        assertThat(q.claimNext(scope(run), "w2", 1)).isEmpty();

        clock.advance(Duration.ofMinutes(2).plusSeconds(1));
        List<WorkItem> reclaimed = q.claimNext(scope(run), "w2", 1);

        assertThat(reclaimed).singleElement().satisfies(i -> {
            assertThat(i.getItemId()).isEqualTo(id);
            assertThat(i.getClaimedBy()).isEqualTo("w2");
            assertThat(i.getAttemptCount()).isEqualTo(2);
        });
        assertThat(q.heartbeat(id, "w1")).isEqualTo(HeartbeatResult.CLAIM_LOST);
        assertThat(q.complete(id, "w1", bytes("late"))).isFalse();
        assertThat(q.complete(id, "w2", bytes("ok"))).isTrue();
        assertThat(q.find(id)).get().extracting(WorkItem::getStatus).isEqualTo(WorkItemStatus.COMPLETED);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("failRetriesUntilMaxAttemptsThenDeadLetters")
    void failRetriesUntilMaxAttemptsThenDeadLetters(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        q.enqueue(run, "flaky", null, 0);

        List<Optional<WorkItemStatus>> results = new ArrayList<>();
        for (int attempt = 1; attempt <= 3; attempt++) {
            WorkItem item = q.claimNext(scope(run), "w1", 1).get(0);
            assertThat(item.getAttemptCount()).isEqualTo(attempt);
            results.add(q.fail(item.getItemId(), "w1", "timeout #" + attempt));
        }

        assertThat(results).containsExactly(
                Optional.of(WorkItemStatus.FAILED), Optional.of(WorkItemStatus.FAILED), Optional.of(WorkItemStatus.DEAD));
        assertThat(q.claimNext(scope(run), "w1", 1)).isEmpty();
        assertThat(q.depth(run)).isEqualTo(new QueueDepth(0, 0, 0, 0, 1));
        assertThat(q.deadItems(run, 10)).singleElement().satisfies(i -> {
            assertThat(i.getNaturalKey()).isEqualTo("flaky");
            assertThat(i.getLastError()).isEqualTo("timeout #3");
        });
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("staleClaimOnFinalAttemptIsDeadLettered")
    void staleClaimOnFinalAttemptIsDeadLettered(String implName, Function<MutableClock, WorkQueue> factory) {
        MutableClock clock = new MutableClock();
        WorkQueue q = factory.apply(clock);
        String run = newRun();
        q.enqueue(new WorkItemRequest(run, 0, "crashy", null, 0, 1));
        q.claimNext(scope(run), "w1", 1);

        clock.advance(EXPIRY.plusSeconds(1));

        assertThat(q.claimNext(scope(run), "w2", 1)).isEmpty();
        assertThat(q.depth(run).dead()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("markDeadSkipsRemainingAttempts")
    void markDeadSkipsRemainingAttempts(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        q.enqueue(run, "broken-layout", null, 0);
        long id = q.claimNext(scope(run), "w1", 1).get(0).getItemId();

        assertThat(q.markDead(id, "w2", "not mine")).isFalse();
        assertThat(q.markDead(id, "w1", "selector missing")).isTrue();

        assertThat(q.find(id)).get().satisfies(i -> {
            assertThat(i.getStatus()).isEqualTo(WorkItemStatus.DEAD);
            assertThat(i.getAttemptCount()).isEqualTo(1);
        });
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("releaseReturnsItemWithoutConsumingAnAttempt")
    void releaseReturnsItemWithoutConsumingAnAttempt(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        q.enqueue(run, "item", null, 0);
        long id = q.claimNext(scope(run), "w1", 1).get(0).getItemId();

        assertThat(q.release(id, "w1")).isTrue();
        assertThat(q.release(id, "w1")).isFalse();

        WorkItem again = q.claimNext(scope(run), "w2", 1).get(0);
        assertThat(again.getItemId()).isEqualTo(id);
        assertThat(again.getAttemptCount()).isEqualTo(1);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("requeueDeadRestoresAttemptBudget")
    void requeueDeadRestoresAttemptBudget(String implName, Function<MutableClock, WorkQueue> factory) {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        q.enqueue(run, "a", null, 0);
        q.enqueue(run, "b", null, 0);
        for (WorkItem i : q.claimNext(scope(run), "w1", 2)) {
            q.markDead(i.getItemId(), "w1", "triage me");
        }

        assertThat(q.requeueDead(run)).isEqualTo(2);

        assertThat(q.depth(run).pending()).isEqualTo(2);
        assertThat(q.claimNext(scope(run), "w1", 2)).allSatisfy(i -> assertThat(i.getAttemptCount()).isEqualTo(1));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("concurrentClaimsNeverHandOutTheSameItemTwice")
    void concurrentClaimsNeverHandOutTheSameItemTwice(String implName, Function<MutableClock, WorkQueue> factory) throws Exception {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        for (int i = 0; i < 200; i++) {
            q.enqueue(run, "item-" + i, null, i % 5);
        }

        int workers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch go = new CountDownLatch(1);
        Map<Long, String> owners = new ConcurrentHashMap<>();
        Set<Long> duplicates = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String worker = "w" + w;
            futures.add(pool.submit(() -> {
                go.await();
                for (;;) {
                    List<WorkItem> batch = q.claimNext(scope(run), worker, 7);
                    if (batch.isEmpty()) return null;
                    for (WorkItem item : batch) {
                        if (owners.putIfAbsent(item.getItemId(), worker) != null) {
                            duplicates.add(item.getItemId());
                        }
                    }
                }
            }));
        }
        go.countDown();
        for (Future<?> f : futures) {
            f.get(60, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(duplicates).isEmpty();
        assertThat(owners).hasSize(200);
        assertThat(q.depth(run).claimed()).isEqualTo(200);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("queueImplementations")
    @DisplayName("hundredItemsAcrossFourWorkersEndCompletedOrDead")
    void hundredItemsAcrossFourWorkersEndCompletedOrDead(String implName, Function<MutableClock, WorkQueue> factory) throws Exception {
        WorkQueue q = factory.apply(new MutableClock());
        String run = newRun();
        for (int i = 0; i < 100; i++) {
            q.enqueue(run, "item-" + i, bytes(Integer.toString(i)), 1 + i % 5);
        }

        Map<Long, String> liveClaims = new ConcurrentHashMap<>();
        AtomicInteger doubleClaims = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < 4; w++) {
            String worker = "worker-" + w;
            futures.add(pool.submit(() -> {
                while (!q.depth(run).isDrained()) {
                    List<WorkItem> batch = q.claimNext(scope(run), worker, 10);
                    if (batch.isEmpty()) {
                        Thread.sleep(5);
                        continue;
                    }
                    for (WorkItem item : batch) {
                        if (liveClaims.putIfAbsent(item.getItemId(), worker) != null) {
                            doubleClaims.incrementAndGet();
                        }
                        int n = Integer.parseInt(new String(item.getPayload(), StandardCharsets.UTF_8));
                        // a failed item may be reclaimed by another worker at once
                        liveClaims.remove(item.getItemId());
                        // every seventh item never succeeds
                        if (n % 7 == 0) {
                            q.fail(item.getItemId(), worker, "always fails");
                        } else {
                            q.complete(item.getItemId(), worker, bytes("ok"));
                        }
                    }
                }
                return null;
            }));
        }
        for (Future<?> f : futures) {
            f.get(120, TimeUnit.SECONDS);
        }
        pool.shutdown();

        QueueDepth depth = q.depth(run);
        assertThat(doubleClaims.get()).isZero();
        assertThat(depth.completed() + depth.dead()).isEqualTo(100);
        assertThat(depth.dead()).isEqualTo(15);
    }
}
