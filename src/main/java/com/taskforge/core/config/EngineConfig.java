package com.taskforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.core.agent.AgentBackend;
import com.taskforge.core.agent.AgentBackends;
import com.taskforge.core.agent.CommandAgentBackend;
import com.taskforge.core.agent.UnavailableAgentBackend;
import com.taskforge.core.engine.Orchestrator;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.ExecutorPool;
import com.taskforge.core.execution.StepExecutor;
import com.taskforge.core.metrics.EngineMetrics;
import com.taskforge.core.model.Tier;
import com.taskforge.core.plan.TaskListLoader;
import com.taskforge.core.routing.DefaultTierRouter;
import com.taskforge.core.routing.TierRouter;
import com.taskforge.core.verify.ShellVerificationRunner;
import com.taskforge.core.verify.VerificationRunner;
import com.taskforge.core.workspace.FileLockManager;
import com.taskforge.core.workspace.LockListener;
import com.taskforge.core.workspace.Workspace;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /**
     * Used when no monitoring backend contributes a registry, so metrics are still
     * recorded in memory.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean(destroyMethod = "close")
    public EventBus eventBus(EngineProperties properties) {
        return new EventBus(properties.getEvents().getQueueCapacity());
    }

    @Bean
    public EngineMetrics engineMetrics(MeterRegistry registry, EventBus eventBus) {
        var metrics = new EngineMetrics(registry);
        metrics.bindEventBus(eventBus);
        return metrics;
    }

    @Bean
    public FileLockManager fileLockManager(EngineProperties properties, EngineMetrics metrics) {
        return lockManager(properties, metrics);
    }

    /** A lock table whose wait times feed the lock-wait timer. */
    public static FileLockManager lockManager(EngineProperties properties, EngineMetrics metrics) {
        var manager = new FileLockManager(properties.getLockPollMillis());
        manager.addListener(new LockListener() {
            @Override
            public void acquired(String owner, String path) {}

            @Override
            public void released(String owner, String path) {}

            @Override
            public void waited(String owner, String path, Duration waited) {
                metrics.recordLockWait(waited);
            }
        });
        return manager;
    }

    @Bean
    public Workspace workspace(EngineProperties properties, FileLockManager lockManager) {
        Path root = Path.of(properties.getWorkspace().getRoot()).toAbsolutePath().normalize();
        log.info("Workspace root: {}", root);
        return new Workspace(root, lockManager);
    }

    @Bean
    public TierRouter tierRouter(EngineProperties properties) {
        return new DefaultTierRouter(properties);
    }

    @Bean
    public VerificationRunner verificationRunner() {
        return new ShellVerificationRunner();
    }

    @Bean
    public TaskListLoader taskListLoader(ObjectMapper objectMapper, EngineProperties properties) {
        return new TaskListLoader(objectMapper, properties.getMaxDepth());
    }

    /**
     * One backend per tier: the configured command when there is one, otherwise a
     * placeholder that reports the tier as unreachable.
     */
    @Bean
    public AgentBackends agentBackends(EngineProperties properties, Workspace workspace,
                                       ObjectMapper objectMapper, TaskListLoader taskListLoader) {
        return new AgentBackends(
                backendFor(Tier.LOCAL, properties, workspace, objectMapper, taskListLoader),
                backendFor(Tier.MID, properties, workspace, objectMapper, taskListLoader),
                backendFor(Tier.PREMIUM, properties, workspace, objectMapper, taskListLoader));
    }

    @Bean(destroyMethod = "close")
    public StepExecutor stepExecutor(Workspace workspace, AgentBackends backends, VerificationRunner verifier,
                                     TierRouter router, EngineProperties properties, EventBus eventBus,
                                     EngineMetrics metrics) {
        return new StepExecutor(workspace, backends, verifier, router, properties, eventBus, metrics);
    }

    @Bean
    public ExecutorPool executorPool(StepExecutor stepExecutor, EventBus eventBus, EngineProperties properties) {
        return new ExecutorPool(stepExecutor, eventBus, properties.getMaxConcurrentTasks());
    }

    @Bean
    public Orchestrator orchestrator(ExecutorPool pool, EventBus eventBus, EngineMetrics metrics) {
        return new Orchestrator(pool, eventBus, metrics);
    }

    private static AgentBackend backendFor(Tier tier, EngineProperties properties, Workspace workspace,
                                           ObjectMapper objectMapper, TaskListLoader loader) {
        var settings = properties.tier(tier);
        if (settings.getCommand() == null || settings.getCommand().isBlank()) {
            log.info("No agent command configured for tier {}", tier);
            return new UnavailableAgentBackend(tier);
        }
        return new CommandAgentBackend(tier, settings.getCommand(), workspace.root(),
                properties.getBackendTimeout(), objectMapper, loader);
    }
}
