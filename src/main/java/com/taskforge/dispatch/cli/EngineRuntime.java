package com.taskforge.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.config.EngineConfig;
import com.taskforge.core.config.EngineProperties;
import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.ExecutorPool;
import com.taskforge.core.execution.StepExecutor;
import com.taskforge.core.metrics.EngineMetrics;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.routing.TierRouter;
import com.taskforge.core.verify.VerificationRunner;
import com.taskforge.core.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Hands out the engine for a CLI run. Without command-line overrides this is the
 * application's own orchestrator. A concurrency override gets a new pool over the shared
 * step executor; a different workspace root gets its own lock table, backends and step
 * executor, which are released when the session closes.
 */
@Component
public class EngineRuntime {

    private static final Logger log = LoggerFactory.getLogger(EngineRuntime.class);

    private final Orchestrator orchestrator;
    private final StepExecutor stepExecutor;
    private final Workspace workspace;
    private final EngineProperties properties;
    private final VerificationRunner verifier;
    private final TierRouter router;
    private final TaskListLoader loader;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;
    private final EngineMetrics metrics;

    public EngineRuntime(Orchestrator orchestrator, StepExecutor stepExecutor, Workspace workspace,
                         EngineProperties properties, VerificationRunner verifier, TierRouter router,
                         TaskListLoader loader, ObjectMapper objectMapper, EventBus eventBus,
                         EngineMetrics metrics) {
        this.orchestrator = orchestrator;
        this.stepExecutor = stepExecutor;
        this.workspace = workspace;
        this.properties = properties;
        this.verifier = verifier;
        this.router = router;
        this.loader = loader;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * The orchestrator for one run, plus whatever was built only for that run.
     *
     * @param orchestrator runs the task list
     * @param ownedExecutor step executor created for this session, or null when it is shared
     */
    public record Session(Orchestrator orchestrator, StepExecutor ownedExecutor) implements AutoCloseable {

        public static Session shared(Orchestrator orchestrator) {
            return new Session(orchestrator, null);
        }

        @Override
        public void close() {
            if (ownedExecutor != null) {
                ownedExecutor.close();
            }
        }
    }

    /**
     * @param root          workspace root override, or null
     * @param maxConcurrent concurrency override, or null
     */
    public Session open(Path root, Integer maxConcurrent) {
        Path normalized = root != null ? root.toAbsolutePath().normalize() : null;
        boolean otherRoot = normalized != null && !normalized.equals(workspace.root());
        if (!otherRoot && maxConcurrent == null) {
            return Session.shared(orchestrator);
        }
        int concurrency = maxConcurrent != null ? maxConcurrent : properties.getMaxConcurrentTasks();
        if (!otherRoot) {
            return Session.shared(newOrchestrator(stepExecutor, concurrency));
        }
        var runWorkspace = new Workspace(normalized, EngineConfig.lockManager(properties, metrics));
        var backends = new EngineConfig().agentBackends(properties, runWorkspace, objectMapper, loader);
        var executor = new StepExecutor(runWorkspace, backends, verifier, router, properties, eventBus, metrics);
        log.info("Using workspace root {} for this run", runWorkspace.root());
        return new Session(newOrchestrator(executor, concurrency), executor);
    }

    private Orchestrator newOrchestrator(StepExecutor executor, int concurrency) {
        return new Orchestrator(new ExecutorPool(executor, eventBus, concurrency), eventBus, metrics);
    }
}
