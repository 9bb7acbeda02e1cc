package com.taskforge.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static TaskStep step(String id, String... deps) {
        return new TaskStep(id, "step " + id, StepCategory.FEATURE, List.of(deps));
    }

    @Nested
    @DisplayName("TaskStep")
    class TaskStepTests {

        @Test
        @DisplayName("starts pending with empty history")
        void startsPending() {
            var s = step("1");
            assertEquals(StepStatus.PENDING, s.status());
            assertTrue(s.tierHistory().isEmpty());
            assertEquals(0, s.attemptCount());
            assertNull(s.verificationCommand());
        }

        @Test
        @DisplayName("rejects blank id")
        void rejectsBlankId() {
            assertThrows(IllegalArgumentException.class, () -> step(" "));
        }

        @Test
        @DisplayName("follows the happy path through the state machine")
        void happyPath() {
            var s = step("1");
            s.transitionTo(StepStatus.ELIGIBLE);
            s.transitionTo(StepStatus.LOCKED);
            s.transitionTo(StepStatus.EXECUTING);
            s.transitionTo(StepStatus.VERIFYING);
            s.transitionTo(StepStatus.EXECUTING);
            s.transitionTo(StepStatus.VERIFYING);
            s.transitionTo(StepStatus.COMPLETED);
            assertEquals(StepStatus.COMPLETED, s.status());
        }

        @Test
        @DisplayName("rejects skipping states")
        void rejectsIllegalTransition() {
            var s = step("1");
            var e = assertThrows(IllegalStateException.class, () -> s.transitionTo(StepStatus.EXECUTING));
            assertTrue(e.getMessage().contains("PENDING"));
        }

        @Test
        @DisplayName("terminal states accept no transition")
        void terminalIsFinal() {
            var s = step("1");
            s.transitionTo(StepStatus.CANCELLED);
            assertThrows(IllegalStateException.class, () -> s.transitionTo(StepStatus.ELIGIBLE));
            assertFalse(s.transitionIfNotTerminal(StepStatus.FAILED));
            assertEquals(StepStatus.CANCELLED, s.status());
        }

        @Test
        @DisplayName("tier history never goes back to a lower tier")
        void rejectsDeEscalation() {
            var s = step("1");
            s.recordAttempt(new TierAttempt(1, Tier.LOCAL, AttemptOutcome.SOFT_FAILURE, "x", 1));
            s.recordAttempt(new TierAttempt(2, Tier.MID, AttemptOutcome.SOFT_FAILURE, "x", 1));
            s.recordAttempt(new TierAttempt(3, Tier.MID, AttemptOutcome.SUCCEEDED, null, 1));
            assertThrows(IllegalStateException.class,
                    () -> s.recordAttempt(new TierAttempt(4, Tier.LOCAL, AttemptOutcome.SUCCEEDED, null, 1)));
            assertEquals(3, s.tierHistory().size());
            assertEquals(1, s.escalationCount());
        }

        @Test
        @DisplayName("duplicate dependencies are collapsed")
        void collapsesDuplicateDependencies() {
            var s = step("3", "1", "2", "1");
            assertEquals(List.of("1", "2"), s.dependencies());
        }

        @Test
        @DisplayName("copyForRetry keeps completed steps and resets the rest")
        void copyForRetry() {
            var done = step("1");
            done.transitionTo(StepStatus.ELIGIBLE);
            done.transitionTo(StepStatus.LOCKED);
            done.transitionTo(StepStatus.EXECUTING);
            done.transitionTo(StepStatus.VERIFYING);
            done.setResult("ok");
            done.transitionTo(StepStatus.COMPLETED);
            var failed = step("2", "1");
            failed.transitionTo(StepStatus.ELIGIBLE);
            failed.nextAttempt();
            failed.transitionTo(StepStatus.FAILED);

            var doneCopy = done.copyForRetry();
            var failedCopy = failed.copyForRetry();

            assertEquals(StepStatus.COMPLETED, doneCopy.status());
            assertEquals("ok", doneCopy.result());
            assertEquals(StepStatus.PENDING, failedCopy.status());
            assertEquals(0, failedCopy.attemptCount());
            assertEquals(List.of("1"), failedCopy.dependencies());
        }
    }

    @Nested
    @DisplayName("TaskList")
    class TaskListTests {

        @Test
        @DisplayName("rejects duplicate step ids")
        void rejectsDuplicateIds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new TaskList("L", "dup", List.of(step("1"), step("1"))));
        }

        @Test
        @DisplayName("runs at most once")
        void startsOnce() {
            var list = new TaskList("L", "t", List.of(step("1")));
            assertEquals(TaskListStatus.NOT_STARTED, list.status());
            list.start();
            assertEquals(TaskListStatus.RUNNING, list.status());
            assertThrows(IllegalStateException.class, list::start);
            list.finish(TaskListStatus.COMPLETED);
            assertThrows(IllegalStateException.class, () -> list.finish(TaskListStatus.FAILED));
        }

        @Test
        @DisplayName("finish requires a terminal status")
        void finishNeedsTerminal() {
            var list = new TaskList("L", "t", List.of(step("1")));
            list.start();
            assertThrows(IllegalArgumentException.class, () -> list.finish(TaskListStatus.RUNNING));
        }

        @Test
        @DisplayName("progress counts completed steps")
        void progress() {
            var a = step("a");
            var b = step("b");
            var c = step("c");
            var d = step("d");
            for (var s : List.of(a, b)) {
                s.transitionTo(StepStatus.ELIGIBLE);
                s.transitionTo(StepStatus.LOCKED);
                s.transitionTo(StepStatus.EXECUTING);
                s.transitionTo(StepStatus.VERIFYING);
                s.transitionTo(StepStatus.COMPLETED);
            }
            c.transitionTo(StepStatus.CANCELLED);
            var list = new TaskList("L", "t", List.of(a, b, c, d));

            assertEquals(50, list.progressPercentage());
            assertEquals(2, list.completedCount());
            assertEquals(1, list.cancelledCount());
            assertEquals(0, list.failedCount());
            assertFalse(list.allTerminal());
        }

        @Test
        @DisplayName("retryCopy produces a fresh list with the same step definitions")
        void retryCopy() {
            var list = new TaskList("L", "t", List.of(step("1"), step("2", "1")), 2);
            list.start();
            list.finish(TaskListStatus.FAILED);

            var copy = list.retryCopy("L-2");

            assertEquals("L-2", copy.id());
            assertEquals(TaskListStatus.NOT_STARTED, copy.status());
            assertEquals(2, copy.maxDepth());
            assertEquals(2, copy.steps().size());
            assertNotSame(list.steps().get(0), copy.steps().get(0));
        }

        @Test
        @DisplayName("step lookup by id")
        void stepLookup() {
            var list = new TaskList("L", "t", List.of(step("1")));
            assertTrue(list.step("1").isPresent());
            assertTrue(list.step("2").isEmpty());
        }
    }

    @Nested
    @DisplayName("Tier")
    class TierTests {

        @Test
        @DisplayName("ranks local below mid below premium")
        void ranks() {
            assertTrue(Tier.MID.isAbove(Tier.LOCAL));
            assertTrue(Tier.PREMIUM.isAbove(Tier.MID));
            assertFalse(Tier.LOCAL.isAbove(Tier.LOCAL));
            assertEquals(Tier.PREMIUM, Tier.highest(Tier.PREMIUM, Tier.LOCAL));
        }
    }
}
