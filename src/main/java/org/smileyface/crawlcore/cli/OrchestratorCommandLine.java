package org.smileyface.crawlcore.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.crawlcore.checkpoint.RunNotFoundException;
import org.smileyface.crawlcore.model.RunStatus;
import org.smileyface.crawlcore.pipeline.PipelineRunner;
import org.smileyface.crawlcore.pipeline.RunOutcome;
import org.smileyface.crawlcore.service.RunDetail;
import org.smileyface.crawlcore.service.StatusService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

/**
 * Command line driver:
 * <pre>
 *   start &lt;fleet&gt; [--fresh|--resume]
 *   stop &lt;runId&gt;
 *   status &lt;runId&gt;
 * </pre>
 * Exit codes: 0 success, 1 run failure (including a run that stopped before completing),
 * 2 invalid invocation. Without a command the application keeps serving the REST surface.
 */
@Component
public class OrchestratorCommandLine implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorCommandLine.class);

    static final Set<String> COMMANDS = Set.of("start", "stop", "status");

    private final PipelineRunner runner;
    private final StatusService status;
    private final ObjectMapper mapper;
    private final PrintStream out;
    private volatile int exitCode = RunOutcome.EXIT_OK;

    @Autowired
    public OrchestratorCommandLine(PipelineRunner runner, StatusService status, ObjectMapper mapper) {
        this(runner, status, mapper, System.out);
    }

    OrchestratorCommandLine(PipelineRunner runner, StatusService status, ObjectMapper mapper, PrintStream out) {
        this.runner = runner;
        this.status = status;
        this.mapper = mapper;
        this.out = out;
    }

    /**
     * True when the raw arguments carry a command word, known or not. An unknown word is
     * still a command line invocation and ends with a usage error.
     */
    public static boolean isCommand(String... args) {
        if (args == null) return false;
        for (String a : args) {
            if (!a.startsWith("--")) return true;
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            return;
        }
        exitCode = execute(words, args.containsOption("fresh"), args.containsOption("resume"));
    }

    int execute(List<String> words, boolean fresh, boolean resume) {
        String command = words.get(0);
        if (!COMMANDS.contains(command)) {
            return usage("unknown command " + command);
        }
        if (words.size() != 2) {
            return usage("'" + command + "' takes exactly one argument");
        }
        String target = words.get(1);
        try {
            return switch (command) {
                case "start" -> {
                    if (fresh && resume) {
                        yield usage("--fresh and --resume are mutually exclusive");
                    }
                    RunOutcome outcome = runner.run(target, fresh);
                    print(outcome);
                    yield outcome.exitCode();
                }
                case "stop" -> {
                    status.run(target);
                    boolean requested = runner.stop(target);
                    out.println(requested ? "Stop requested for run " + target : "Run " + target + " is already finished");
                    yield requested ? RunOutcome.EXIT_OK : RunOutcome.EXIT_RUN_FAILED;
                }
                case "status" -> {
                    RunDetail detail = status.run(target);
                    print(detail);
                    RunStatus s = detail.run().getStatus();
                    yield s == RunStatus.FAILED || s == RunStatus.STOPPED ? RunOutcome.EXIT_RUN_FAILED : RunOutcome.EXIT_OK;
                }
                default -> throw new IllegalStateException("unhandled command " + command);
            };
        } catch (RunNotFoundException | IllegalArgumentException e) {
            return usage(e.getMessage());
        }
    }

    private int usage(String problem) {
        log.error("Invalid invocation: {}", problem);
        out.println("error: " + problem);
        out.println("usage: start <fleet> [--fresh|--resume] | stop <runId> | status <runId>");
        return RunOutcome.EXIT_USAGE;
    }

    private void print(Object value) {
        try {
            out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + value.getClass().getSimpleName(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
