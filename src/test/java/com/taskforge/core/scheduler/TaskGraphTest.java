package com.taskforge.core.scheduler;

import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private static TaskStep step(String id, List<String> deps, List<String> paths) {
        return new TaskStep(id, "step " + id, StepCategory.FEATURE, deps, paths, null, null);
    }

    private static TaskStep step(String id, String... deps) {
        return step(id, List.of(deps), List.of());
    }

    private static List<String> ids(List<TaskStep> steps) {
        return steps.stream().map(TaskStep::id).toList();
    }

    private static void complete(TaskStep s) {
        s.transitionTo(StepStatus.ELIGIBLE);
        s.transitionTo(StepStatus.LOCKED);
        s.transitionTo(StepStatus.EXECUTING);
        s.transitionTo(StepStatus.VERIFYING);
        s.transitionTo(StepStatus.COMPLETED);
    }

    private static TaskGraph graph(TaskStep... steps) {
        return TaskGraph.of(new TaskList("L", "test", List.of(steps)));
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts a sound graph")
        void soundGraph() {
            assertTrue(graph(step("1"), step("2", "1"), step("3", "1", "2")).validate().isEmpty());
        }

        @Test
        @DisplayName("reports unknown and self dependencies")
        void unknownAndSelf() {
            var problems = graph(step("1", "9"), step("2", "2")).validate();
            assertEquals(2, problems.size());
            assertEquals(StructuralProblem.Kind.UNKNOWN_DEPENDENCY, problems.get(0).kind());
            assertEquals("1", problems.get(0).stepId());
            assertEquals(StructuralProblem.Kind.SELF_DEPENDENCY, problems.get(1).kind());
        }

        @Test
        @DisplayName("reports a cycle with its path")
        void cycle() {
            var problems = graph(step("a", "c"), step("b", "a"), step("c", "b")).validate();
            assertEquals(1, problems.size());
            var cycle = problems.get(0);
            assertEquals(StructuralProblem.Kind.CYCLE, cycle.kind());
            assertTrue(cycle.detail().contains("a -> c -> b -> a"), cycle.detail());
        }

        @Test
        @DisplayName("reports declared paths that escape the workspace")
        void invalidPath() {
            var problems = graph(step("1", List.of(), List.of("../secrets.txt"))).validate();
            assertEquals(1, problems.size());
            assertEquals(StructuralProblem.Kind.INVALID_PATH, problems.get(0).kind());
        }
    }

    @Nested
    @DisplayName("eligibleSteps")
    class Eligible {

        @Test
        @DisplayName("only steps whose dependencies completed")
        void dependencies() {
            var a = step("a");
            var b = step("b", "a");
            var c = step("c");
            var g = graph(a, b, c);

            assertEquals(List.of("a", "c"), ids(g.eligibleSteps()));
            complete(a);
            g.markSettled("a");
            assertEquals(List.of("b", "c"), ids(g.eligibleSteps()));
        }

        @Test
        @DisplayName("a completed dependency counts only once it is settled")
        void unsettledDependency() {
            var a = step("a");
            var b = step("b", "a");
            var g = graph(a, b);

            complete(a);
            assertTrue(g.eligibleSteps().isEmpty());
            assertTrue(g.hasInFlight());
            assertFalse(g.isStalled());

            g.markSettled("a");
            assertTrue(g.isSettled("a"));
            assertEquals(List.of("b"), ids(g.eligibleSteps()));
            assertFalse(g.hasInFlight());
        }

        @Test
        @DisplayName("steps already completed when the graph is built count as settled")
        void carriedOver() {
            var a = step("a");
            complete(a);
            var g = graph(a, step("b", "a"));

            assertTrue(g.isSettled("a"));
            assertEquals(List.of("b"), ids(g.eligibleSteps()));
        }

        @Test
        @DisplayName("independent steps writing the same file are serialized")
        void overlappingPaths() {
            var a = step("a", List.of(), List.of("src/lib.rs"));
            var b = step("b", List.of(), List.of("./src/lib.rs"));
            var c = step("c", List.of(), List.of("src/main.rs"));
            var g = graph(a, b, c);

            assertEquals(List.of("a", "c"), ids(g.eligibleSteps()));
            a.transitionTo(StepStatus.ELIGIBLE);
            assertEquals(List.of("c"), ids(g.eligibleSteps()));
        }

        @Test
        @DisplayName("path suffixes count as the same file")
        void suffixMatch() {
            var a = step("a", List.of(), List.of("crate/src/lib.rs"));
            var b = step("b", List.of(), List.of("src/lib.rs"));
            assertEquals(List.of("a"), ids(graph(a, b).eligibleSteps()));
        }

        @Test
        @DisplayName("discovered paths join the conflict footprint")
        void discoveredPaths() {
            var a = step("a");
            var b = step("b", List.of(), List.of("Cargo.toml"));
            var g = graph(a, b);
            a.transitionTo(StepStatus.ELIGIBLE);
            assertEquals(List.of("b"), ids(g.eligibleSteps()));

            g.recordDiscoveredPath("a", "Cargo.toml");
            assertTrue(g.eligibleSteps().isEmpty());
            assertEquals(Set.of("Cargo.toml"), g.pathsOf("a"));
        }
    }

    @Nested
    @DisplayName("recordConflict")
    class Conflicts {

        @Test
        @DisplayName("makes the later step wait until the earlier one finishes")
        void conflictEdge() {
            var a = step("a");
            var b = step("b");
            var g = graph(a, b);

            assertTrue(g.recordConflict("a", "b"));
            a.transitionTo(StepStatus.ELIGIBLE);
            assertTrue(g.eligibleSteps().isEmpty());
            a.transitionTo(StepStatus.FAILED);
            assertTrue(g.eligibleSteps().isEmpty());
            g.markSettled("a");
            assertEquals(List.of("b"), ids(g.eligibleSteps()));
        }

        @Test
        @DisplayName("ignores an edge contradicting an existing ordering")
        void ignoresReverse() {
            var g = graph(step("a"), step("b", "a"));
            assertFalse(g.recordConflict("b", "a"));
            assertTrue(g.conflictPredecessorsOf("a").isEmpty());
            assertTrue(g.recordConflict("a", "b"));
            assertFalse(g.recordConflict("a", "b"));
        }
    }

    @Nested
    @DisplayName("failure and stall detection")
    class Stalls {

        @Test
        @DisplayName("blockedByFailure lists pending dependents of failed steps")
        void blockedByFailure() {
            var a = step("a");
            var b = step("b", "a");
            var c = step("c", "b");
            var g = graph(a, b, c);
            a.transitionTo(StepStatus.ELIGIBLE);
            a.transitionTo(StepStatus.FAILED);

            assertEquals(List.of("b"), ids(g.blockedByFailure()));
            b.transitionTo(StepStatus.CANCELLED);
            assertEquals(List.of("c"), ids(g.blockedByFailure()));
        }

        @Test
        @DisplayName("a graph with nothing eligible and nothing running is stalled")
        void stalled() {
            var a = step("a");
            var b = step("b", "a");
            var g = graph(a, b);
            assertFalse(g.isStalled());

            a.transitionTo(StepStatus.ELIGIBLE);
            a.transitionTo(StepStatus.LOCKED);
            assertFalse(g.isStalled());
            assertTrue(g.hasInFlight());
        }

        @Test
        @DisplayName("describeStall names what each pending step waits on")
        void describeStall() {
            var g = graph(step("a"), step("b", "a"));
            var problem = g.describeStall();
            assertEquals(StructuralProblem.Kind.STALLED, problem.kind());
            assertTrue(problem.detail().contains("b waits on [a]"), problem.detail());
        }

        @Test
        @DisplayName("allTerminal once every step finished")
        void allTerminal() {
            var a = step("a");
            var g = graph(a);
            assertFalse(g.allTerminal());
            complete(a);
            assertTrue(g.allTerminal());
            assertFalse(g.hasPending());
        }
    }
}
