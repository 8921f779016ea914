package org.smileyface.crawlcore.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.crawlcore.model.StepDefinition;
import org.smileyface.crawlcore.pipeline.FleetPipeline;
import org.smileyface.crawlcore.pipeline.PipelineRunner;
import org.smileyface.crawlcore.pipeline.RunOutcome;
import org.smileyface.crawlcore.pipeline.Seed;
import org.smileyface.crawlcore.service.StatusService;
import org.smileyface.crawlcore.worker.FailureKind;
import org.smileyface.crawlcore.worker.FetchOutcome;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class OrchestratorCommandLineTest {

    @Autowired
    private PipelineRunner runner;

    @Autowired
    private StatusService status;

    @Autowired
    private ObjectMapper mapper;

    private ByteArrayOutputStream buffer;
    private OrchestratorCommandLine cli;

    @TestConfiguration
    static class FleetConfig {
        @Bean
        public FleetPipeline catalogFleet() {
            return new FleetPipeline("catalog",
                    List.of(StepDefinition.queue(0, "products")),
                    (runId, step) -> List.of(Seed.of("sku-1", null, 0), Seed.of("sku-2", null, 0)),
                    (target, proxy, browser) -> FetchOutcome.success(new byte[0]));
        }

        @Bean
        public FleetPipeline lockedOutFleet() {
            return new FleetPipeline("locked-out",
                    List.of(StepDefinition.queue(0, "products")),
                    (runId, step) -> List.of(Seed.of("sku-1", null, 0)),
                    (target, proxy, browser) -> FetchOutcome.failure(FailureKind.FATAL, "credentials rejected"));
        }
    }

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        cli = new OrchestratorCommandLine(runner, status, mapper, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    void startRunsTheFleetToCompletion() {
        int code = cli.execute(List.of("start", "catalog"), true, false);

        assertThat(code).isEqualTo(RunOutcome.EXIT_OK);
        assertThat(output()).contains("\"completed\"").contains("catalog");
    }

    @Test
    void statusOfAFailedRunExitsWithRunFailure() {
        assertThat(cli.execute(List.of("start", "locked-out"), true, false)).isEqualTo(RunOutcome.EXIT_RUN_FAILED);
        String runId = status.runs("locked-out", 1).get(0).getRunId();

        buffer.reset();
        assertThat(cli.execute(List.of("status", runId), false, false)).isEqualTo(RunOutcome.EXIT_RUN_FAILED);
        assertThat(output()).contains("\"failed\"").contains("credentials rejected");
    }

    @Test
    void statusOfACompletedRunSucceeds() {
        cli.execute(List.of("start", "catalog"), true, false);
        String runId = status.runs("catalog", 1).get(0).getRunId();

        assertThat(cli.execute(List.of("status", runId), false, false)).isEqualTo(RunOutcome.EXIT_OK);
    }

    @Test
    void stoppingAFinishedRunReportsRunFailure() {
        cli.execute(List.of("start", "catalog"), true, false);
        String runId = status.runs("catalog", 1).get(0).getRunId();

        buffer.reset();
        assertThat(cli.execute(List.of("stop", runId), false, false)).isEqualTo(RunOutcome.EXIT_RUN_FAILED);
        assertThat(output()).contains("already finished");
    }

    @Test
    void invalidInvocationsExitWithUsage() {
        assertThat(cli.execute(List.of("start"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("start", "catalog", "extra"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("start", "catalog"), true, true)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("start", "nobody"), true, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("status", "no-such-run"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("stop", "no-such-run"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(output()).contains("usage:").contains("mutually exclusive").contains("Unknown fleet: nobody");
    }

    @Test
    void unknownCommandWordsExitWithUsage() {
        assertThat(cli.execute(List.of("strat", "catalog"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(cli.execute(List.of("halt"), false, false)).isEqualTo(RunOutcome.EXIT_USAGE);
        assertThat(output()).contains("unknown command strat").contains("unknown command halt");
    }

    @Test
    void anyCommandWordSwitchesToCommandLineMode() {
        assertThat(OrchestratorCommandLine.isCommand("start", "catalog")).isTrue();
        assertThat(OrchestratorCommandLine.isCommand("--server.port=0", "status", "abc")).isTrue();
        assertThat(OrchestratorCommandLine.isCommand("strat", "catalog")).isTrue();
        assertThat(OrchestratorCommandLine.isCommand("--fresh")).isFalse();
        assertThat(OrchestratorCommandLine.isCommand("--server.port=0")).isFalse();
        assertThat(OrchestratorCommandLine.isCommand()).isFalse();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
