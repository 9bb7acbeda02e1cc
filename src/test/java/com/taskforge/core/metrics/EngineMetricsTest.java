package com.taskforge.core.metrics;

import com.taskforge.core.events.EngineEvents;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.model.AttemptOutcome;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.Tier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class EngineMetricsTest {

    private SimpleMeterRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    @Test
    @DisplayName("recordStepDuration tags by final tier and status")
    void recordStepDuration() {
        metrics.recordStepDuration(Tier.MID, StepStatus.COMPLETED, 250);
        var timer = registry.find("taskforge.step.duration")
                .tag("tier", "mid").tag("status", "completed").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordAttempt counts by tier and outcome")
    void recordAttempt() {
        metrics.recordAttempt(Tier.LOCAL, AttemptOutcome.SOFT_FAILURE);
        metrics.recordAttempt(Tier.LOCAL, AttemptOutcome.SOFT_FAILURE);
        metrics.recordAttempt(Tier.MID, AttemptOutcome.SUCCEEDED);

        var soft = registry.find("taskforge.step.attempts")
                .tag("tier", "local").tag("outcome", "soft_failure").counter();
        var ok = registry.find("taskforge.step.attempts")
                .tag("tier", "mid").tag("outcome", "succeeded").counter();
        assertNotNull(soft);
        assertNotNull(ok);
        assertEquals(2.0, soft.count());
        assertEquals(1.0, ok.count());
    }

    @Test
    @DisplayName("incrementEscalations counts by reason")
    void incrementEscalations() {
        metrics.incrementEscalations("soft");
        metrics.incrementEscalations("hard");
        metrics.incrementEscalations("soft");
        assertEquals(2.0, registry.find("taskforge.escalations.total").tag("reason", "soft").counter().count());
        assertEquals(1.0, registry.find("taskforge.escalations.total").tag("reason", "hard").counter().count());
    }

    @Test
    @DisplayName("recordTaskListResult counts by status")
    void recordTaskListResult() {
        metrics.recordTaskListResult(TaskListStatus.COMPLETED);
        metrics.recordTaskListResult(TaskListStatus.PARTIALLY_COMPLETED);
        var partial = registry.find("taskforge.tasklists.total").tag("status", "partially_completed").counter();
        assertNotNull(partial);
        assertEquals(1.0, partial.count());
    }

    @Test
    @DisplayName("rollback, lock wait, cost and decomposition meters register")
    void otherMeters() {
        metrics.recordRollback();
        metrics.recordLockWait(Duration.ofMillis(40));
        metrics.recordStepCost(0.004);
        metrics.recordDecomposition(2);

        assertEquals(1.0, registry.find("taskforge.workspace.rollbacks").counter().count());
        assertEquals(1, registry.find("taskforge.lock.wait").timer().count());
        assertEquals(0.004, registry.find("taskforge.step.cost").summary().totalAmount(), 1e-9);
        assertEquals(2.0, registry.find("taskforge.decomposition.depth").summary().totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("bindEventBus exposes dropped events as a gauge")
    void bindEventBus() {
        try (var bus = new EventBus(1)) {
            metrics.bindEventBus(bus);
            // A blocked subscriber keeps the single slot occupied
            var release = new CountDownLatch(1);
            bus.subscribeAll(e -> {
                try {
                    release.await();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });
            for (int i = 0; i < 10; i++) {
                bus.publish(EngineEvents.listEvent(EngineEvents.TASKLIST_STARTED, "L", EngineEvents.payload()));
            }
            var gauge = registry.find("taskforge.events.dropped").gauge();
            assertNotNull(gauge);
            assertTrue(gauge.value() > 0);
            release.countDown();
        }
    }
}
