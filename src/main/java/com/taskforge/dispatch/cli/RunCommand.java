package com.taskforge.dispatch.cli;

import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.engine.TaskListReport;
import com.taskforge.core.error.TaskListLoadException;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.plan.TaskListLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: taskforge run &lt;plan.json&gt;
 * <p>
 * Loads a plan, runs it against the workspace and streams progress events to the
 * console. Ctrl-C cancels the run; in-flight steps are rolled back before the JVM exits.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a task list from a plan file")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_NOT_COMPLETED = 1;
    static final int EXIT_INVALID_PLAN = 2;

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @Parameters(index = "0", description = "Path to the JSON plan file")
    private Path planFile;

    @Option(names = {"--root", "-r"}, description = "Workspace root (default: taskforge.workspace.root)")
    private Path root;

    @Option(names = {"--max-concurrent", "-c"}, description = "Maximum steps running at once")
    private Integer maxConcurrent;

    private final EngineRuntime runtime;
    private final TaskListLoader loader;
    private final EventBus eventBus;

    public RunCommand(EngineRuntime runtime, TaskListLoader loader, EventBus eventBus) {
        this.runtime = runtime;
        this.loader = loader;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TaskList list = loadPlan(loader, planFile);
        if (list == null) {
            return EXIT_INVALID_PLAN;
        }
        if (maxConcurrent != null && maxConcurrent < 1) {
            ConsoleOutput.error("--max-concurrent must be at least 1");
            return EXIT_INVALID_PLAN;
        }
        try (EngineRuntime.Session session = runtime.open(root, maxConcurrent)) {
            return run(session.orchestrator(), list);
        }
    }

    private int run(Orchestrator orchestrator, TaskList list) {
        var problems = orchestrator.validate(list);
        if (!problems.isEmpty()) {
            ConsoleOutput.error("Task list " + list.id() + " is invalid:");
            ConsoleOutput.problems(problems);
            return EXIT_INVALID_PLAN;
        }

        ConsoleOutput.info("Running " + list.id() + " (" + list.steps().size() + " steps)");
        var token = new CancellationToken();
        var finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            if (token.cancel("interrupted by user")) {
                ConsoleOutput.warn("Cancelling " + list.id() + "...");
            }
            try {
                finished.await(SHUTDOWN_GRACE.toSeconds(), TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "taskforge-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        TaskListReport report;
        try {
            report = orchestrator.run(list, token);
        } finally {
            finished.countDown();
            flushEvents();
            subscription.unsubscribe();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress, hook stays registered");
            }
        }

        ConsoleOutput.report(report);
        return report.succeeded() ? 0 : EXIT_NOT_COMPLETED;
    }

    /**
     * @return the list, or null after printing the reason it could not be loaded
     */
    static TaskList loadPlan(TaskListLoader loader, Path planFile) {
        try {
            return loader.load(planFile);
        } catch (TaskListLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return null;
        }
    }

    private void flushEvents() {
        try {
            if (!eventBus.awaitIdle(Duration.ofSeconds(2))) {
                log.debug("Event queue not drained before printing the report");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
