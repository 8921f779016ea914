package org.smileyface.crawlcore.checkpoint;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.smileyface.crawlcore.model.Run;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.model.Step;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.model.StepMetrics;
import org.smileyface.crawlcore.model.StepStatus;
import org.smileyface.crawlcore.testutil.MutableClock;
import org.smileyface.crawlcore.testutil.PostgresTestContainer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CheckpointManager over each RunStore: in-memory always, PostgreSQL when Docker is available.
 */
class CheckpointManagerParameterizedTest {

    private static final Logger logger = LogManager.getLogger(CheckpointManagerParameterizedTest.class);
    private static final List<StepDefinition> STEPS = List.of(
            StepDefinition.queue(0, "listing"),
            StepDefinition.frontier(1, "discover"),
            StepDefinition.queue(2, "details"));
    private static List<Arguments> IMPLEMENTATIONS;

    static Stream<Arguments> storeImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (CheckpointManagerParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of("InMemoryRunStore",
                            (Function<MutableClock, CheckpointManager>) clock -> new CheckpointManager(new InMemoryRunStore(), clock)));
                    try {
                        PostgresTestContainer.start();
                        IMPLEMENTATIONS.add(Arguments.of("JdbcRunStore",
                                (Function<MutableClock, CheckpointManager>) clock -> {
                                    // stale recovery scans every running run
                                    PostgresTestContainer.truncate("pipeline_steps", "pipeline_runs");
                                    return new CheckpointManager(new JdbcRunStore(PostgresTestContainer.jdbcTemplate(),
                                            PostgresTestContainer.transactionTemplate()), clock);
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

    private static String newFleet() {
        return "fleet-" + UUID.randomUUID();
    }

    private static void runStep(CheckpointManager cm, MutableClock clock, String runId, int n, Duration took) {
        cm.markStepStart(runId, n);
        clock.advance(took);
        cm.markStepComplete(runId, n, new StepMetrics(10, 10, 10, 0, 0));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("freshRunStartsAtTheFirstStepWithEveryStepPending")
    void freshRunStartsAtTheFirstStepWithEveryStepPending(String implName, Function<MutableClock, CheckpointManager> factory) {
        CheckpointManager cm = factory.apply(new MutableClock());

        RunContext ctx = cm.initRun(newFleet(), true, STEPS);

        assertThat(ctx.isResumed()).isFalse();
        assertThat(ctx.getStartStep()).isZero();
        Run run = cm.run(ctx.getRunId()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getStepCount()).isEqualTo(3);
        assertThat(cm.steps(ctx.getRunId())).extracting(Step::getStatus).containsOnly(StepStatus.PENDING);
        assertThat(cm.steps(ctx.getRunId())).extracting(Step::getName).containsExactly("listing", "discover", "details");
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("resumeContinuesAtTheFailedStep")
    void resumeContinuesAtTheFailedStep(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String fleet = newFleet();
        String runId = cm.initRun(fleet, true, STEPS).getRunId();
        runStep(cm, clock, runId, 0, Duration.ofSeconds(1));
        runStep(cm, clock, runId, 1, Duration.ofSeconds(1));
        cm.markStepStart(runId, 2);
        assertThat(cm.markStepFailed(runId, 2, StepMetrics.EMPTY, "site changed its layout", false)).isTrue();
        assertThat(cm.run(runId).orElseThrow().getStatus()).isEqualTo(RunStatus.FAILED);

        RunContext resumed = cm.initRun(fleet, false, STEPS);

        assertThat(resumed.getRunId()).isEqualTo(runId);
        assertThat(resumed.isResumed()).isTrue();
        assertThat(resumed.getStartStep()).isEqualTo(2);
        assertThat(cm.resumePoint(runId)).isEqualTo(2);
        Run run = cm.run(runId).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.getErrorMessage()).isNull();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("continueOnErrorFailureIsSkippedAndDoesNotHalt")
    void continueOnErrorFailureIsSkippedAndDoesNotHalt(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String fleet = newFleet();
        String runId = cm.initRun(fleet, true, STEPS).getRunId();
        cm.markStepStart(runId, 0);

        assertThat(cm.markStepFailed(runId, 0, StepMetrics.EMPTY, "listing api down", true)).isFalse();

        Step skipped = cm.steps(runId).get(0);
        assertThat(skipped.getStatus()).isEqualTo(StepStatus.SKIPPED);
        assertThat(skipped.getErrorMessage()).isEqualTo("listing api down");
        assertThat(cm.run(runId).orElseThrow().getStatus()).isEqualTo(RunStatus.RUNNING);

        runStep(cm, clock, runId, 1, Duration.ofSeconds(1));
        cm.markStopped(runId);
        assertThat(cm.initRun(fleet, false, STEPS).getStartStep()).isEqualTo(2);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("resumeWithoutCandidateThrows")
    void resumeWithoutCandidateThrows(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String fleet = newFleet();

        assertThatThrownBy(() -> cm.initRun(fleet, false, STEPS)).isInstanceOf(NoResumableRunException.class);

        String runId = cm.initRun(fleet, true, STEPS).getRunId();
        for (int n = 0; n < STEPS.size(); n++) {
            runStep(cm, clock, runId, n, Duration.ofSeconds(1));
        }
        assertThat(cm.finalizeRun(runId).getStatus()).isEqualTo(RunStatus.COMPLETED);

        // completed runs are history, never resumed
        assertThatThrownBy(() -> cm.initRun(fleet, false, STEPS)).isInstanceOf(NoResumableRunException.class);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("resumePrefersTheRunWithTheMostItemsScraped")
    void resumePrefersTheRunWithTheMostItemsScraped(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String fleet = newFleet();
        String older = cm.initRun(fleet, true, STEPS).getRunId();
        cm.addItemsScraped(older, 40);
        cm.markStopped(older);
        clock.advance(Duration.ofMinutes(1));
        String newer = cm.initRun(fleet, true, STEPS).getRunId();
        cm.addItemsScraped(newer, 5);
        cm.markStopped(newer);

        assertThat(cm.initRun(fleet, false, STEPS).getRunId()).isEqualTo(older);
        assertThat(cm.run(older).orElseThrow().getItemsScraped()).isEqualTo(40L);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("completingAStepAheadOfAnUnfinishedOneIsRejected")
    void completingAStepAheadOfAnUnfinishedOneIsRejected(String implName, Function<MutableClock, CheckpointManager> factory) {
        CheckpointManager cm = factory.apply(new MutableClock());
        String runId = cm.initRun(newFleet(), true, STEPS).getRunId();
        cm.markStepStart(runId, 1);

        assertThatThrownBy(() -> cm.markStepComplete(runId, 1, StepMetrics.EMPTY))
                .isInstanceOf(CheckpointViolationException.class)
                .hasMessageContaining("step 0");
        assertThat(cm.steps(runId).get(1).getStatus()).isEqualTo(StepStatus.IN_PROGRESS);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("restartingAFinishedStepIsRejected")
    void restartingAFinishedStepIsRejected(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String runId = cm.initRun(newFleet(), true, STEPS).getRunId();
        runStep(cm, clock, runId, 0, Duration.ofSeconds(5));
        cm.markStepStart(runId, 1);
        cm.markStepFailed(runId, 1, StepMetrics.EMPTY, "sitemap missing", true);

        assertThatThrownBy(() -> cm.markStepStart(runId, 0))
                .isInstanceOf(CheckpointViolationException.class)
                .hasMessageContaining("already completed");
        assertThatThrownBy(() -> cm.markStepStart(runId, 1))
                .isInstanceOf(CheckpointViolationException.class)
                .hasMessageContaining("already skipped");
        Step first = cm.steps(runId).get(0);
        assertThat(first.getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(first.getMetrics()).isEqualTo(new StepMetrics(10, 10, 10, 0, 0));
        assertThat(cm.steps(runId).get(1).getStatus()).isEqualTo(StepStatus.SKIPPED);
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("staleRunRecoveryStopsOnlyIdleRunningRuns")
    void staleRunRecoveryStopsOnlyIdleRunningRuns(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String idle = cm.initRun(newFleet(), true, STEPS).getRunId();
        clock.advance(Duration.ofMinutes(10));
        String busy = cm.initRun(newFleet(), true, STEPS).getRunId();
        clock.advance(Duration.ofMinutes(1));
        cm.touch(busy);

        List<String> recovered = cm.staleRunRecovery(Duration.ofMinutes(5));

        assertThat(recovered).containsExactly(idle);
        assertThat(cm.run(idle).orElseThrow().getStatus()).isEqualTo(RunStatus.STOPPED);
        assertThat(cm.run(busy).orElseThrow().getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(cm.staleRunRecovery(Duration.ofMinutes(5))).isEmpty();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("finalizeRunWritesAggregatesOfACompletedRun")
    void finalizeRunWritesAggregatesOfACompletedRun(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String runId = cm.initRun(newFleet(), true, STEPS).getRunId();
        runStep(cm, clock, runId, 0, Duration.ofSeconds(2));
        runStep(cm, clock, runId, 1, Duration.ofSeconds(5));
        runStep(cm, clock, runId, 2, Duration.ofSeconds(1));

        Run run = cm.finalizeRun(runId);

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(run.getTotalRuntimeSeconds()).isEqualTo(8.0);
        assertThat(run.getSlowestStep()).isEqualTo(1);
        assertThat(run.getSlowestStepName()).isEqualTo("discover");
        assertThat(run.getCurrentStep()).isEqualTo(3);
        assertThat(run.getEndedAt()).isNotNull();
        assertThat(cm.steps(runId).get(1).getMetrics()).isEqualTo(new StepMetrics(10, 10, 10, 0, 0));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("finalizeRunReportsFailureAndStop")
    void finalizeRunReportsFailureAndStop(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);

        String failed = cm.initRun(newFleet(), true, STEPS).getRunId();
        runStep(cm, clock, failed, 0, Duration.ofSeconds(1));
        cm.markStepStart(failed, 1);
        cm.markStepFailed(failed, 1, StepMetrics.EMPTY, "captcha wall", false);
        Run f = cm.finalizeRun(failed);
        assertThat(f.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(f.getFailureStep()).isEqualTo(1);
        assertThat(f.getFailureStepName()).isEqualTo("discover");
        assertThat(f.getErrorMessage()).isEqualTo("captcha wall");

        String stopped = cm.initRun(newFleet(), true, STEPS).getRunId();
        runStep(cm, clock, stopped, 0, Duration.ofSeconds(1));
        cm.markStepStart(stopped, 1);
        Run s = cm.finalizeRun(stopped);
        assertThat(s.getStatus()).isEqualTo(RunStatus.STOPPED);
        assertThat(s.getFailureStep()).isNull();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("stopRequestsAreRefusedForTerminalOrUnknownRuns")
    void stopRequestsAreRefusedForTerminalOrUnknownRuns(String implName, Function<MutableClock, CheckpointManager> factory) {
        MutableClock clock = new MutableClock();
        CheckpointManager cm = factory.apply(clock);
        String runId = cm.initRun(newFleet(), true, List.of(StepDefinition.queue(0, "only"))).getRunId();

        assertThat(cm.isStopRequested(runId)).isFalse();
        assertThat(cm.requestStop(runId)).isTrue();
        assertThat(cm.isStopRequested(runId)).isTrue();

        runStep(cm, clock, runId, 0, Duration.ofSeconds(1));
        cm.finalizeRun(runId);
        assertThat(cm.requestStop(runId)).isFalse();
        assertThat(cm.requestStop("no-such-run")).isFalse();
        assertThat(cm.isStopRequested("no-such-run")).isFalse();
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("storeImplementations")
    @DisplayName("stepDefinitionsMustBeNumberedInOrder")
    void stepDefinitionsMustBeNumberedInOrder(String implName, Function<MutableClock, CheckpointManager> factory) {
        CheckpointManager cm = factory.apply(new MutableClock());

        assertThatThrownBy(() -> cm.initRun(newFleet(), true, List.of(StepDefinition.queue(1, "late"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cm.initRun(newFleet(), true, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cm.initRun(" ", true, STEPS))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
