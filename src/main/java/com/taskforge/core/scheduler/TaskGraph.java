package com.taskforge.core.scheduler;

import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.workspace.WorkspacePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conflict-aware dependency graph over one {@link TaskList}.
 * <p>
 * Decides which pending steps may be dispatched now: a step is eligible when all of its
 * dependencies completed, every step it was found to conflict with has finished, and none
 * of its paths overlap the paths of a step already in flight. A dependency only counts
 * once it is settled, meaning the coordinator has merged its result into the execution
 * context; a step that reached a terminal state on its worker is not settled yet.
 * Steps returned together never overlap each other either, so overlapping steps are
 * serialized across waves.
 * <p>
 * Not thread-safe: the executor pool's coordinator thread is the only caller.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final TaskList taskList;
    private final Map<String, TaskStep> steps = new LinkedHashMap<>();
    private final Map<String, Set<String>> declaredPaths = new HashMap<>();
    private final Map<String, Set<String>> discoveredPaths = new HashMap<>();

    /** later step id -> earlier step ids it must wait for. */
    private final Map<String, Set<String>> conflictPredecessors = new HashMap<>();

    /** Terminal steps whose outcome the coordinator has already applied. */
    private final Set<String> settled = new HashSet<>();

    private TaskGraph(TaskList taskList) {
        this.taskList = taskList;
        for (var step : taskList.steps()) {
            steps.put(step.id(), step);
            var paths = new LinkedHashSet<String>();
            for (String p : step.declaredPaths()) {
                paths.add(WorkspacePaths.normalizeLenient(p));
            }
            declaredPaths.put(step.id(), paths);
            for (String p : step.discoveredPaths()) {
                recordDiscoveredPath(step.id(), p);
            }
            if (step.status().isTerminal()) {
                settled.add(step.id());
            }
        }
    }

    public static TaskGraph of(TaskList taskList) {
        return new TaskGraph(taskList);
    }

    public TaskList taskList() {
        return taskList;
    }

    /**
     * Checks the graph for problems that make it impossible to run: dependencies on unknown
     * or on the same step, dependency cycles, and declared paths that leave the workspace.
     *
     * @return the problems found, empty when the graph is sound
     */
    public List<StructuralProblem> validate() {
        var problems = new ArrayList<StructuralProblem>();
        for (var step : steps.values()) {
            for (String dep : step.dependencies()) {
                if (dep.equals(step.id())) {
                    problems.add(new StructuralProblem(StructuralProblem.Kind.SELF_DEPENDENCY, step.id(),
                            "step depends on itself"));
                } else if (!steps.containsKey(dep)) {
                    problems.add(new StructuralProblem(StructuralProblem.Kind.UNKNOWN_DEPENDENCY, step.id(),
                            "unknown dependency '" + dep + "'"));
                }
            }
            for (String path : step.declaredPaths()) {
                try {
                    WorkspacePaths.normalize(path);
                } catch (IllegalArgumentException e) {
                    problems.add(new StructuralProblem(StructuralProblem.Kind.INVALID_PATH, step.id(),
                            e.getMessage()));
                }
            }
        }
        problems.addAll(findCycles());
        return problems;
    }

    /**
     * Steps that may be dispatched now, in declaration order. The result is built greedily,
     * so no two returned steps share a path.
     */
    public List<TaskStep> eligibleSteps() {
        var claimed = new HashSet<String>();
        for (var step : steps.values()) {
            if (step.status().isInFlight()) {
                claimed.addAll(pathsOf(step.id()));
            }
        }

        var eligible = new ArrayList<TaskStep>();
        for (var step : steps.values()) {
            if (step.status() != StepStatus.PENDING) {
                continue;
            }
            if (!dependenciesCompleted(step)) {
                continue;
            }
            if (!conflictPredecessorsFinished(step)) {
                log.debug("  {} waits for conflicting step(s) {}", step.id(), conflictPredecessors.get(step.id()));
                continue;
            }
            Set<String> paths = pathsOf(step.id());
            String overlap = firstOverlap(paths, claimed);
            if (overlap != null) {
                log.debug("  {} deferred: {} is claimed by an in-flight or earlier eligible step", step.id(), overlap);
                continue;
            }
            eligible.add(step);
            claimed.addAll(paths);
        }
        return eligible;
    }

    /**
     * Records that {@code laterId} must not start before {@code earlierId} finishes, even
     * though neither depends on the other. Ignored when the reverse ordering is already
     * implied, since honoring it would make the graph unsatisfiable.
     *
     * @return true if the edge was recorded
     */
    public boolean recordConflict(String earlierId, String laterId) {
        if (earlierId.equals(laterId) || !steps.containsKey(earlierId) || !steps.containsKey(laterId)) {
            return false;
        }
        if (mustPrecede(laterId, earlierId)) {
            log.debug("Conflict {} -> {} ignored: {} already precedes {}", earlierId, laterId, laterId, earlierId);
            return false;
        }
        boolean added = conflictPredecessors.computeIfAbsent(laterId, k -> new LinkedHashSet<>()).add(earlierId);
        if (added) {
            log.info("File conflict: step {} will wait for step {}", laterId, earlierId);
        }
        return added;
    }

    /**
     * Marks a terminal step as settled: its result has been merged, so its dependents and
     * conflict successors may start.
     */
    public void markSettled(String stepId) {
        if (steps.containsKey(stepId)) {
            settled.add(stepId);
        }
    }

    public boolean isSettled(String stepId) {
        return settled.contains(stepId);
    }

    /** Adds a path a step touched at runtime to its conflict footprint. */
    public void recordDiscoveredPath(String stepId, String path) {
        if (!steps.containsKey(stepId)) {
            return;
        }
        String normalized = WorkspacePaths.normalizeLenient(path);
        if (discoveredPaths.computeIfAbsent(stepId, k -> new LinkedHashSet<>()).add(normalized)) {
            log.debug("Step {} discovered path {}", stepId, normalized);
        }
    }

    /** Declared and discovered paths of a step. */
    public Set<String> pathsOf(String stepId) {
        var paths = new LinkedHashSet<>(declaredPaths.getOrDefault(stepId, Set.of()));
        paths.addAll(discoveredPaths.getOrDefault(stepId, Set.of()));
        return paths;
    }

    /** Conflict predecessors recorded for a step. */
    public Set<String> conflictPredecessorsOf(String stepId) {
        return Set.copyOf(conflictPredecessors.getOrDefault(stepId, Set.of()));
    }

    /** Pending steps that can never run because a dependency failed or was cancelled. */
    public List<TaskStep> blockedByFailure() {
        var blocked = new ArrayList<TaskStep>();
        for (var step : steps.values()) {
            if (step.status() != StepStatus.PENDING) {
                continue;
            }
            for (String dep : step.dependencies()) {
                TaskStep d = steps.get(dep);
                if (d != null && (d.status() == StepStatus.FAILED || d.status() == StepStatus.CANCELLED)) {
                    blocked.add(step);
                    break;
                }
            }
        }
        return blocked;
    }

    /** Whether a step is running or has finished without being settled. */
    public boolean hasInFlight() {
        return steps.values().stream().anyMatch(s -> s.status().isInFlight()
                || (s.status().isTerminal() && !settled.contains(s.id())));
    }

    public boolean hasPending() {
        return steps.values().stream().anyMatch(s -> s.status() == StepStatus.PENDING);
    }

    public boolean allTerminal() {
        return steps.values().stream().allMatch(s -> s.status().isTerminal());
    }

    /**
     * True when pending steps remain but none is eligible and nothing is running, so the
     * graph can never make progress again.
     */
    public boolean isStalled() {
        return hasPending() && !hasInFlight() && eligibleSteps().isEmpty();
    }

    /** Describes why each pending step is stuck, for the structural error report. */
    public StructuralProblem describeStall() {
        var reasons = new ArrayList<String>();
        for (var step : steps.values()) {
            if (step.status() != StepStatus.PENDING) {
                continue;
            }
            var waitingOn = new ArrayList<String>();
            for (String dep : step.dependencies()) {
                TaskStep d = steps.get(dep);
                if (d == null || d.status() != StepStatus.COMPLETED) {
                    waitingOn.add(dep);
                }
            }
            for (String earlier : conflictPredecessors.getOrDefault(step.id(), Set.of())) {
                if (!steps.get(earlier).status().isTerminal()) {
                    waitingOn.add(earlier + " (conflict)");
                }
            }
            reasons.add(step.id() + " waits on " + waitingOn);
        }
        return new StructuralProblem(StructuralProblem.Kind.STALLED, null,
                "no step can make progress: " + String.join(", ", reasons));
    }

    // -- internals --

    private boolean dependenciesCompleted(TaskStep step) {
        for (String dep : step.dependencies()) {
            TaskStep d = steps.get(dep);
            if (d == null || d.status() != StepStatus.COMPLETED || !settled.contains(dep)) {
                return false;
            }
        }
        return true;
    }

    private boolean conflictPredecessorsFinished(TaskStep step) {
        for (String earlier : conflictPredecessors.getOrDefault(step.id(), Set.of())) {
            if (!steps.get(earlier).status().isTerminal() || !settled.contains(earlier)) {
                return false;
            }
        }
        return true;
    }

    /** Whether {@code first} must finish before {@code second} through dependencies or conflict edges. */
    private boolean mustPrecede(String first, String second) {
        var visited = new HashSet<String>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(second);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            TaskStep step = steps.get(current);
            if (step == null) {
                continue;
            }
            var predecessors = new ArrayList<>(step.dependencies());
            predecessors.addAll(conflictPredecessors.getOrDefault(current, Set.of()));
            for (String p : predecessors) {
                if (p.equals(first)) {
                    return true;
                }
                stack.push(p);
            }
        }
        return false;
    }

    private List<StructuralProblem> findCycles() {
        var problems = new ArrayList<StructuralProblem>();
        var state = new HashMap<String, Integer>();   // 1 = on stack, 2 = done
        for (String id : steps.keySet()) {
            if (!state.containsKey(id)) {
                visit(id, state, new ArrayList<>(), problems);
            }
        }
        return problems;
    }

    private void visit(String id, Map<String, Integer> state, List<String> path, List<StructuralProblem> problems) {
        state.put(id, 1);
        path.add(id);
        for (String dep : steps.get(id).dependencies()) {
            if (dep.equals(id) || !steps.containsKey(dep)) {
                continue;
            }
            Integer depState = state.get(dep);
            if (depState == null) {
                visit(dep, state, path, problems);
            } else if (depState == 1) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                problems.add(StructuralProblem.cycle(cycle));
            }
        }
        path.remove(path.size() - 1);
        state.put(id, 2);
    }

    /**
     * Paths match when equal, or when one is a path suffix of the other, so that
     * "src/lib.rs" and "crate/src/lib.rs" are treated as the same file.
     */
    private static String firstOverlap(Set<String> paths, Set<String> claimed) {
        if (paths.isEmpty() || claimed.isEmpty()) {
            return null;
        }
        for (String path : paths) {
            for (String other : claimed) {
                if (path.equals(other) || path.endsWith("/" + other) || other.endsWith("/" + path)) {
                    return path;
                }
            }
        }
        return null;
    }
}
