package com.taskforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.agent.AgentBackends;
import com.taskforge.core.config.EngineProperties;
import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.execution.ExecutorPool;
import com.taskforge.core.execution.ScriptedBackend;
import com.taskforge.core.execution.StepExecutor;
import com.taskforge.core.metrics.EngineMetrics;
import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.routing.DefaultTierRouter;
import com.taskforge.core.verify.VerificationResult;
import com.taskforge.core.verify.VerificationRunner;
import com.taskforge.core.workspace.FileLock;
import com.taskforge.core.workspace.FileLockManager;
import com.taskforge.core.workspace.Workspace;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineRuntimeTest {

    @TempDir
    Path sharedRoot;

    @TempDir
    Path otherRoot;

    private final EngineProperties properties = new EngineProperties();
    private final EventBus eventBus = new EventBus(256);
    private final EngineMetrics metrics = new EngineMetrics(new SimpleMeterRegistry());
    private final FileLockManager sharedLocks = new FileLockManager(5);
    private final VerificationRunner verifier =
            (command, cwd, timeout, token) -> new VerificationResult(command, 0, "", "", 1);
    private StepExecutor sharedExecutor;
    private Orchestrator sharedOrchestrator;
    private EngineRuntime runtime;

    @BeforeEach
    void setUp() {
        properties.getExecution().setMaxRetries(0);
        properties.getExecution().setSoftRetryCount(0);
        String greeter = "cat > /dev/null; echo '{\"summary\": \"greeted\","
                + " \"files\": [{\"path\": \"hello.txt\", \"content\": \"hi\"}]}'";
        properties.getTiers().getLocal().setCommand(greeter);
        properties.getTiers().getMid().setCommand(greeter);
        properties.getTiers().getPremium().setCommand(greeter);
        var workspace = new Workspace(sharedRoot.toAbsolutePath().normalize(), sharedLocks);
        var router = new DefaultTierRouter(properties);
        var loader = new TaskListLoader(3);
        sharedExecutor = new StepExecutor(workspace, AgentBackends.uniform(new ScriptedBackend()), verifier, router,
                properties, eventBus, metrics);
        sharedOrchestrator = new Orchestrator(new ExecutorPool(sharedExecutor, eventBus, 2), eventBus, metrics);
        runtime = new EngineRuntime(sharedOrchestrator, sharedExecutor, workspace, properties, verifier, router,
                loader, new ObjectMapper(), eventBus, metrics);
    }

    @AfterEach
    void tearDown() {
        sharedExecutor.close();
        eventBus.close();
    }

    @Test
    @DisplayName("without overrides the application's orchestrator is used")
    void noOverrides() {
        try (var session = runtime.open(null, null)) {
            assertSame(sharedOrchestrator, session.orchestrator());
            assertNull(session.ownedExecutor());
        }
    }

    @Test
    @DisplayName("the configured root with a concurrency override shares the step executor")
    void concurrencyOnly() {
        try (var session = runtime.open(sharedRoot, 4)) {
            assertNotSame(sharedOrchestrator, session.orchestrator());
            assertNull(session.ownedExecutor());
        }
    }

    @Test
    @DisplayName("another root runs against its own files and its own lock table")
    void otherRoot() throws Exception {
        FileLock held = sharedLocks.acquire("X/held", "hello.txt", new CancellationToken());
        var step = new TaskStep("a", "greet", StepCategory.FEATURE, List.of(), List.of("hello.txt"), "true", null);

        try (var session = runtime.open(otherRoot, null)) {
            assertNotNull(session.ownedExecutor());
            var report = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> session.orchestrator().run(new TaskList("L", "greet", List.of(step))));

            assertEquals(TaskListStatus.COMPLETED, report.status());
            assertEquals("hi", Files.readString(otherRoot.resolve("hello.txt")));
            assertFalse(Files.exists(sharedRoot.resolve("hello.txt")));
            assertEquals(1, sharedLocks.lockedCount());
        } finally {
            held.close();
        }
    }
}
