package com.taskforge.dispatch.cli;

import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.engine.TaskListReport;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.execution.StepExecutor;
import com.taskforge.core.model.FailureKind;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.scheduler.StructuralProblem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Taskforge CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * with a mocked orchestrator behind the commands.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path dir;

    private final TaskListLoader loader = new TaskListLoader(3);
    private final Orchestrator orchestrator = mock(Orchestrator.class);
    private final EngineRuntime runtime = mock(EngineRuntime.class);
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus(64);
        when(runtime.open(any(), any())).thenReturn(EngineRuntime.Session.shared(orchestrator));
        when(orchestrator.validate(any(TaskList.class))).thenReturn(List.of());
    }

    @AfterEach
    void tearDown() {
        eventBus.close();
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(runtime, loader, eventBus);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(loader, orchestrator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new TaskforgeCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path plan(String json) throws IOException {
        Path file = dir.resolve("plan.json");
        Files.writeString(file, json);
        return file;
    }

    private Path validPlan() throws IOException {
        return plan("""
                {"id": "TF-1", "title": "demo", "steps": [
                  {"id": "a", "description": "first"},
                  {"id": "b", "description": "second", "dependencies": ["a"]}
                ]}
                """);
    }

    private static TaskListReport report(TaskListStatus status, List<TaskListReport.StepReport> steps) {
        return new TaskListReport("TF-1", "demo", status, List.of(), steps, 0.25, 42);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Taskforge 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Usage: taskforge"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("a valid plan exits 0")
        void valid() throws Exception {
            CliResult result = execute("validate", validPlan().toString());
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TF-1 is valid (2 steps)"));
        }

        @Test
        @DisplayName("structural problems are listed and exit 2")
        void problems() throws Exception {
            when(orchestrator.validate(any(TaskList.class))).thenReturn(List.of(
                    StructuralProblem.cycle(List.of("a", "b", "a"))));
            CliResult result = execute("validate", validPlan().toString());
            assertEquals(RunCommand.EXIT_INVALID_PLAN, result.exitCode());
            assertTrue(result.output().contains("a -> b -> a"));
        }

        @Test
        @DisplayName("malformed JSON exits 2")
        void malformed() throws Exception {
            CliResult result = execute("validate", plan("{ not json").toString());
            assertEquals(RunCommand.EXIT_INVALID_PLAN, result.exitCode());
        }

        @Test
        @DisplayName("a missing file exits 2")
        void missingFile() {
            CliResult result = execute("validate", dir.resolve("absent.json").toString());
            assertEquals(RunCommand.EXIT_INVALID_PLAN, result.exitCode());
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("a completed run prints the report and exits 0")
        void completed() throws Exception {
            var step = new TaskListReport.StepReport("a", StepStatus.COMPLETED, null, null, 1, List.of(),
                    "ok", "done", 0.25);
            when(orchestrator.run(any(TaskList.class), any(CancellationToken.class)))
                    .thenReturn(report(TaskListStatus.COMPLETED, List.of(step)));

            CliResult result = execute("run", validPlan().toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK LIST TF-1: demo"));
            assertTrue(result.output().contains("COMPLETED in 42 ms"));
        }

        @Test
        @DisplayName("a failed run shows the failure and exits 1")
        void failed() throws Exception {
            var step = new TaskListReport.StepReport("a", StepStatus.FAILED, FailureKind.EXHAUSTED,
                    "verification still failing on PREMIUM:\nerror[E0425]", 3, List.of(), "error", null, 0.5);
            when(orchestrator.run(any(TaskList.class), any(CancellationToken.class)))
                    .thenReturn(report(TaskListStatus.FAILED, List.of(step)));

            CliResult result = execute("run", validPlan().toString());

            assertEquals(RunCommand.EXIT_NOT_COMPLETED, result.exitCode());
            assertTrue(result.output().contains("EXHAUSTED: verification still failing on PREMIUM:"));
            assertFalse(result.output().contains("E0425"));
        }

        @Test
        @DisplayName("overrides are handed to the runtime")
        void overrides() throws Exception {
            when(orchestrator.run(any(TaskList.class), any(CancellationToken.class)))
                    .thenReturn(report(TaskListStatus.COMPLETED, List.of()));

            CliResult result = execute("run", "--root", dir.toString(), "-c", "2", validPlan().toString());

            assertEquals(0, result.exitCode());
            verify(runtime).open(eq(dir), eq(2));
        }

        @Test
        @DisplayName("an engine built for the run is closed afterwards")
        void closesSession() throws Exception {
            var owned = mock(StepExecutor.class);
            when(runtime.open(any(), any())).thenReturn(new EngineRuntime.Session(orchestrator, owned));
            when(orchestrator.run(any(TaskList.class), any(CancellationToken.class)))
                    .thenReturn(report(TaskListStatus.COMPLETED, List.of()));

            CliResult result = execute("run", "--root", dir.toString(), validPlan().toString());

            assertEquals(0, result.exitCode());
            verify(owned).close();
        }

        @Test
        @DisplayName("an invalid plan never runs")
        void invalidPlan() throws Exception {
            when(orchestrator.validate(any(TaskList.class))).thenReturn(List.of(
                    new StructuralProblem(StructuralProblem.Kind.UNKNOWN_DEPENDENCY, "b", "depends on unknown step 'z'")));

            CliResult result = execute("run", validPlan().toString());

            assertEquals(RunCommand.EXIT_INVALID_PLAN, result.exitCode());
            verify(orchestrator, never()).run(any(TaskList.class), any(CancellationToken.class));
        }

        @Test
        @DisplayName("a concurrency bound below one is rejected")
        void badConcurrency() throws Exception {
            CliResult result = execute("run", "-c", "0", validPlan().toString());

            assertEquals(RunCommand.EXIT_INVALID_PLAN, result.exitCode());
            assertTrue(result.output().contains("--max-concurrent must be at least 1"));
        }
    }

    @Nested
    @DisplayName("Spring runner")
    class RunnerTests {

        private CliResult runWith(CliRunner runner, String... args) {
            ByteArrayOutputStream capture = new ByteArrayOutputStream();
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(capture, true));
            try {
                runner.run(args);
                return new CliResult(runner.getExitCode(), capture.toString());
            } finally {
                System.setOut(originalOut);
            }
        }

        @Test
        @DisplayName("reports the command's exit code")
        void exitCode() throws Exception {
            when(orchestrator.run(any(TaskList.class), any(CancellationToken.class)))
                    .thenReturn(report(TaskListStatus.FAILED, List.of()));

            CliResult result = runWith(new CliRunner(new TaskforgeCommand(), createFactory()),
                    "run", validPlan().toString());

            assertEquals(RunCommand.EXIT_NOT_COMPLETED, result.exitCode());
        }

        @Test
        @DisplayName("a command that throws exits with the crash code and a short message")
        void crashed() throws Exception {
            when(runtime.open(any(), any())).thenThrow(new IllegalStateException("workspace root is not a directory"));

            CliResult result = runWith(new CliRunner(new TaskforgeCommand(), createFactory()),
                    "run", validPlan().toString());

            assertEquals(CliRunner.EXIT_CRASHED, result.exitCode());
            assertTrue(result.output().contains("run failed: workspace root is not a directory"), result.output());
        }
    }
}
