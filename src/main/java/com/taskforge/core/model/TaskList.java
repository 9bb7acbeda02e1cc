package com.taskforge.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * An ordered collection of {@link TaskStep}s forming a dependency graph, plus the
 * list-level lifecycle status.
 *
 * <p>A list produced by a step's decomposition records its parent as plain ids
 * ({@link #parentListId()}, {@link #parentStepId()}); lists never hold references to
 * each other.
 */
public class TaskList {

    public static final int DEFAULT_MAX_DEPTH = 3;

    private final String id;
    private final String title;
    private final List<TaskStep> steps;
    private final int maxDepth;
    private String parentListId;
    private String parentStepId;
    private TaskListStatus status = TaskListStatus.NOT_STARTED;

    public TaskList(String id, String title, List<TaskStep> steps, int maxDepth) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task list id cannot be empty");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, was " + maxDepth);
        }
        var seen = new HashSet<String>();
        for (var step : steps) {
            if (!seen.add(step.id())) {
                throw new IllegalArgumentException("Duplicate step id " + step.id() + " in task list " + id);
            }
        }
        this.id = id;
        this.title = title != null ? title : id;
        this.steps = List.copyOf(steps);
        this.maxDepth = maxDepth;
    }

    public TaskList(String id, String title, List<TaskStep> steps) {
        this(id, title, steps, DEFAULT_MAX_DEPTH);
    }

    public String id() { return id; }
    public String title() { return title; }
    public List<TaskStep> steps() { return steps; }
    public int maxDepth() { return maxDepth; }

    public synchronized String parentListId() { return parentListId; }
    public synchronized String parentStepId() { return parentStepId; }

    public synchronized void attachToParent(String parentListId, String parentStepId) {
        this.parentListId = parentListId;
        this.parentStepId = parentStepId;
    }

    public Optional<TaskStep> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public synchronized TaskListStatus status() {
        return status;
    }

    /** Enters RUNNING. A list runs at most once; create a new list to retry. */
    public synchronized void start() {
        if (status != TaskListStatus.NOT_STARTED) {
            throw new IllegalStateException("Task list " + id + " cannot start from " + status);
        }
        status = TaskListStatus.RUNNING;
    }

    /** Records the terminal status. */
    public synchronized void finish(TaskListStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Task list " + id + " already finished as " + status);
        }
        status = terminal;
    }

    public long completedCount() {
        return steps.stream().filter(s -> s.status() == StepStatus.COMPLETED).count();
    }

    public long failedCount() {
        return steps.stream().filter(s -> s.status() == StepStatus.FAILED).count();
    }

    public long cancelledCount() {
        return steps.stream().filter(s -> s.status() == StepStatus.CANCELLED).count();
    }

    public boolean allTerminal() {
        return steps.stream().allMatch(s -> s.status().isTerminal());
    }

    /** Completed steps as a percentage of all steps (0-100). */
    public int progressPercentage() {
        if (steps.isEmpty()) {
            return 0;
        }
        return (int) (completedCount() * 100 / steps.size());
    }

    /**
     * Builds a new, not-yet-started list with the same steps. Completed steps stay completed;
     * the rest start over from PENDING with empty history.
     */
    public TaskList retryCopy(String newId) {
        var copies = new ArrayList<TaskStep>(steps.size());
        for (var step : steps) {
            copies.add(step.copyForRetry());
        }
        return new TaskList(newId, title, copies, maxDepth);
    }

    /** Builds a new, not-yet-started list under another id with every step back at PENDING. */
    public TaskList freshCopy(String newId) {
        var copies = new ArrayList<TaskStep>(steps.size());
        for (var step : steps) {
            copies.add(step.freshCopy());
        }
        return new TaskList(newId, title, copies, maxDepth);
    }

    @Override
    public String toString() {
        return "TaskList[" + id + ", " + steps.size() + " steps, " + status() + "]";
    }
}
