package org.smileyface.crawlcore.resource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.smileyface.crawlcore.model.BrowserInstance;
import org.smileyface.crawlcore.testutil.MutableClock;
import org.smileyface.crawlcore.testutil.PostgresTestContainer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract tests for ResourceTracker implementations: in-memory always, PostgreSQL when Docker
 * is available.
 */
class ResourceTrackerParameterizedTest {

    private static final Logger logger = LogManager.getLogger(ResourceTrackerParameterizedTest.class);
    private static List<Arguments> IMPLEMENTATIONS;

    static Stream<Arguments> trackerImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (ResourceTrackerParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of("InMemoryResourceTracker",
                            (Function<MutableClock, ResourceTracker>) InMemoryResourceTracker::new));
                    try {
                        PostgresTestContainer.start();
                        IMPLEMENTATIONS.add(Arguments.of("JdbcResourceTracker",
                                (Function<MutableClock, ResourceTracker>) clock -> {
                                    // sweeps and counts span every run
                                    PostgresTestContainer.truncate("browser_instances");
                                    return new JdbcResourceTracker(PostgresTestContainer.jdbcTemplate(), clock);
                                }));
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

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("trackerImplementations")
    @DisplayName("onlyTheFirstTerminationIsRecorded")
    void onlyTheFirstTerminationIsRecorded(String implName, Function<MutableClock, ResourceTracker> factory) {
        ResourceTracker tracker = factory.apply(new MutableClock());
        String run = newRun();
        BrowserInstance b = tracker.register(run, 1, 7L, 4242L, 1L);

        assertThat(b.isActive()).isTrue();
        assertThat(tracker.markTerminated(b.getInstanceId(), BrowserInstance.REASON_CRASH)).isTrue();
        assertThat(tracker.markTerminated(b.getInstanceId(), BrowserInstance.REASON_COMPLETED)).isFalse();
        assertThat(tracker.markTerminated(b.getInstanceId() + 1000, BrowserInstance.REASON_COMPLETED)).isFalse();
        assertThat(tracker.activeInstances(run)).isEmpty();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("trackerImplementations")
    @DisplayName("markTerminatedByProcessIdClosesOnlyActiveRecordsOfThatProcess")
    void markTerminatedByProcessIdClosesOnlyActiveRecordsOfThatProcess(String implName, Function<MutableClock, ResourceTracker> factory) {
        ResourceTracker tracker = factory.apply(new MutableClock());
        String run = newRun();
        tracker.register(run, 0, 1L, 100L, null);
        tracker.register(run, 0, 2L, 100L, null);
        BrowserInstance other = tracker.register(run, 0, 3L, 200L, null);

        assertThat(tracker.markTerminatedByProcessId(100L, BrowserInstance.REASON_CRASH)).isEqualTo(2);
        assertThat(tracker.markTerminatedByProcessId(100L, BrowserInstance.REASON_CRASH)).isZero();
        assertThat(tracker.activeInstances(run)).extracting(BrowserInstance::getInstanceId)
                .containsExactly(other.getInstanceId());
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("trackerImplementations")
    @DisplayName("sweepOrphansClosesOnlyInstancesOlderThanMaxAge")
    void sweepOrphansClosesOnlyInstancesOlderThanMaxAge(String implName, Function<MutableClock, ResourceTracker> factory) {
        MutableClock clock = new MutableClock();
        ResourceTracker tracker = factory.apply(clock);
        String run = newRun();
        BrowserInstance old = tracker.register(run, 0, 1L, 300L, null);
        clock.advance(Duration.ofMinutes(20));
        BrowserInstance fresh = tracker.register(run, 0, 2L, 301L, null);
        clock.advance(Duration.ofMinutes(20));

        List<BrowserInstance> swept = tracker.sweepOrphans(Duration.ofMinutes(30));

        assertThat(swept).extracting(BrowserInstance::getProcessId).containsExactly(old.getProcessId());
        assertThat(swept.get(0).getTerminationReason()).isEqualTo(BrowserInstance.REASON_ORPHAN_CLEANUP);
        assertThat(tracker.activeInstances(null)).extracting(BrowserInstance::getInstanceId)
                .containsExactly(fresh.getInstanceId());
        assertThat(tracker.activeCount()).isEqualTo(1);
        assertThat(tracker.sweepOrphans(Duration.ofMinutes(30))).isEmpty();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("trackerImplementations")
    @DisplayName("activeInstancesFiltersByRun")
    void activeInstancesFiltersByRun(String implName, Function<MutableClock, ResourceTracker> factory) {
        ResourceTracker tracker = factory.apply(new MutableClock());
        String runA = newRun();
        String runB = newRun();
        tracker.register(runA, 0, 1L, 10L, null);
        tracker.register(runB, 2, 1L, 11L, 1L);

        assertThat(tracker.activeInstances(runA)).extracting(BrowserInstance::getProcessId).containsExactly(10L);
        assertThat(tracker.activeInstances(runB)).singleElement()
                .satisfies(b -> {
                    assertThat(b.getStepNumber()).isEqualTo(2);
                    assertThat(b.getParentProcessId()).isEqualTo(1L);
                });
        assertThat(tracker.activeInstances(null)).hasSize(2);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("trackerImplementations")
    @DisplayName("trackedResourceRecordsCompletionOrTheAbnormalReason")
    void trackedResourceRecordsCompletionOrTheAbnormalReason(String implName, Function<MutableClock, ResourceTracker> factory) {
        ResourceTracker tracker = factory.apply(new MutableClock());
        String run = newRun();

        try (TrackedResource r = tracker.track(run, 0, 500L, null)) {
            assertThat(tracker.activeInstances(run)).hasSize(1);
            assertThat(r.getProcessId()).isEqualTo(500L);
        }
        TrackedResource crashed = tracker.track(run, 0, 501L, null);
        crashed.markAbnormal(BrowserInstance.REASON_CRASH);
        crashed.close();
        crashed.close();

        assertThat(tracker.activeInstances(run)).isEmpty();
        assertThat(tracker.activeCount()).isZero();
    }
}
