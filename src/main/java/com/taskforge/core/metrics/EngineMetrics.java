package com.taskforge.core.metrics;

import com.taskforge.core.events.EventBus;
import com.taskforge.core.model.AttemptOutcome;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.Tier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for Taskforge task list execution.
 */
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStepDuration(Tier finalTier, StepStatus status, long ms) {
        Timer.builder("taskforge.step.duration")
                .tag("tier", tag(finalTier))
                .tag("status", tag(status))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAttempt(Tier tier, AttemptOutcome outcome) {
        Counter.builder("taskforge.step.attempts")
                .tag("tier", tag(tier))
                .tag("outcome", tag(outcome))
                .register(registry)
                .increment();
    }

    /**
     * @param reason "hard" or "soft"
     */
    public void incrementEscalations(String reason) {
        Counter.builder("taskforge.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRollback() {
        Counter.builder("taskforge.workspace.rollbacks")
                .description("Workspace transactions rolled back")
                .register(registry)
                .increment();
    }

    /**
     * Records how long a step waited for a file lock held by another step.
     */
    public void recordLockWait(Duration waited) {
        Timer.builder("taskforge.lock.wait")
                .description("Time spent waiting for contended file locks")
                .register(registry)
                .record(waited);
    }

    public void recordTaskListResult(TaskListStatus status) {
        Counter.builder("taskforge.tasklists.total")
                .tag("status", tag(status))
                .register(registry)
                .increment();
    }

    public void recordStepCost(double cost) {
        DistributionSummary.builder("taskforge.step.cost")
                .description("Summed tier cost per finished step")
                .register(registry)
                .record(cost);
    }

    public void recordDecomposition(int depth) {
        DistributionSummary.builder("taskforge.decomposition.depth")
                .description("Remaining depth when a step decomposed")
                .register(registry)
                .record(depth);
    }

    /** Exposes the bus's dropped-event count as a gauge. */
    public void bindEventBus(EventBus eventBus) {
        Gauge.builder("taskforge.events.dropped", eventBus, EventBus::droppedCount)
                .description("Progress events dropped under backpressure")
                .register(registry);
    }

    private static String tag(Enum<?> value) {
        return value == null ? "none" : value.name().toLowerCase(Locale.ROOT);
    }
}
