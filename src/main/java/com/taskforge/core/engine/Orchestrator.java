package com.taskforge.core.engine;

import com.taskforge.core.context.ExecutionContext;
import com.taskforge.core.events.EngineEvents;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.execution.DecompositionRunner;
import com.taskforge.core.execution.ExecutorPool;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.EngineMetrics;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.scheduler.StructuralProblem;
import com.taskforge.core.scheduler.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the lifecycle of task lists: registers them in the {@link TaskListArena}, runs them
 * through the {@link ExecutorPool} and reports the outcome.
 * <p>
 * Nested lists produced by decomposition come back through {@link #runChild} and follow
 * exactly the same protocol as top-level lists, including their own terminal event.
 */
public class Orchestrator implements DecompositionRunner {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final AtomicInteger LIST_COUNTER = new AtomicInteger(0);

    private final ExecutorPool pool;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final TaskListArena arena = new TaskListArena();
    private final Map<String, CancellationToken> activeTokens = new ConcurrentHashMap<>();

    public Orchestrator(ExecutorPool pool, EventBus eventBus, EngineMetrics metrics) {
        this.pool = pool;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs a top-level task list to completion on the calling thread.
     */
    public TaskListReport run(TaskList list) {
        return run(list, new CancellationToken());
    }

    /**
     * Runs a top-level task list to completion on the calling thread.
     *
     * @param list  a list that has not been started yet
     * @param token cancels the run; {@link #cancel(String)} has the same effect
     * @return the final report; the list itself carries the same terminal status
     */
    public TaskListReport run(TaskList list, CancellationToken token) {
        Map<String, String> savedMdc = MdcContext.snapshot();
        try {
            admit(list);
            return execute(list, list.maxDepth(), token);
        } finally {
            MdcContext.restore(savedMdc);
        }
    }

    /**
     * Runs a fresh copy of a finished list. Steps that completed stay completed and are not re-run.
     *
     * @throws IllegalArgumentException if no list with that id is known
     * @throws IllegalStateException    if the list has not finished yet
     */
    public TaskListReport retry(String taskListId, CancellationToken token) {
        TaskList previous = arena.get(taskListId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task list: " + taskListId));
        if (!previous.status().isTerminal()) {
            throw new IllegalStateException("Task list " + taskListId + " is still " + previous.status());
        }
        TaskList copy = previous.retryCopy(generateTaskListId());
        log.info("Retrying task list {} as {}", taskListId, copy.id());
        return run(copy, token);
    }

    /**
     * Checks a list for structural problems without running anything.
     */
    public List<StructuralProblem> validate(TaskList list) {
        return TaskGraph.of(list).validate();
    }

    /**
     * Requests cancellation of a running list. Nested lists started by its steps are cancelled too.
     *
     * @return false if the list is not running
     */
    public boolean cancel(String taskListId) {
        CancellationToken token = activeTokens.get(taskListId);
        if (token == null) {
            return false;
        }
        log.info("Cancellation requested for task list {}", taskListId);
        token.cancel("cancelled by request");
        return true;
    }

    @Override
    public TaskListStatus runChild(TaskList child, String parentListId, String parentStepId,
                                   int remainingDepth, CancellationToken token) {
        child.attachToParent(parentListId, parentStepId);
        try {
            admit(child);
        } catch (IllegalStateException e) {
            log.error("Child task list {} of {}/{} rejected: {}", child.id(), parentListId, parentStepId, e.getMessage());
            return TaskListStatus.FAILED;
        }
        Map<String, String> savedMdc = MdcContext.snapshot();
        try {
            return execute(child, remainingDepth, token.child()).status();
        } finally {
            MdcContext.restore(savedMdc);
        }
    }

    public Optional<TaskList> taskList(String taskListId) {
        return arena.get(taskListId);
    }

    public TaskListArena arena() {
        return arena;
    }

    /**
     * Generates a unique task list id in the format TF-YYYY-NNNN.
     */
    public String generateTaskListId() {
        int count = LIST_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("TF-%d-%04d", year, count);
    }

    /**
     * Registers a list and moves it to RUNNING.
     *
     * @throws IllegalStateException if the id is taken by another list or the list already ran
     */
    private void admit(TaskList list) {
        arena.register(list);
        list.start();
    }

    private TaskListReport execute(TaskList list, int remainingDepth, CancellationToken token) {
        MdcContext.setTaskList(list.id());
        activeTokens.put(list.id(), token);
        long started = System.currentTimeMillis();
        log.info("Starting task list {} '{}' with {} steps (depth left {}, parent {})",
                list.id(), list.title(), list.steps().size(), remainingDepth,
                list.parentListId() != null ? list.parentListId() + "/" + list.parentStepId() : "none");
        eventBus.publish(EngineEvents.listEvent(EngineEvents.TASKLIST_STARTED, list.id(), EngineEvents.payload(
                "title", list.title(),
                "steps", list.steps().size(),
                "parentTaskListId", list.parentListId(),
                "parentStepId", list.parentStepId())));

        TaskListStatus status;
        List<StructuralProblem> problems = List.of();
        try {
            var result = pool.run(list, new ExecutionContext(), remainingDepth, token, this);
            status = result.status();
            problems = result.problems();
        } catch (RuntimeException e) {
            log.error("Task list {} aborted: {}", list.id(), e.getMessage(), e);
            for (var step : list.steps()) {
                if (step.transitionIfNotTerminal(StepStatus.CANCELLED)) {
                    eventBus.publish(EngineEvents.stepEvent(EngineEvents.STEP_CANCELLED, list.id(), step.id(),
                            EngineEvents.payload("reason", "task list aborted")));
                }
            }
            status = TaskListStatus.FAILED;
        } finally {
            activeTokens.remove(list.id());
        }

        list.finish(status);
        long duration = System.currentTimeMillis() - started;
        var report = TaskListReport.of(list, problems, duration);
        eventBus.publish(EngineEvents.listEvent(EngineEvents.terminalType(status), list.id(), EngineEvents.payload(
                "completed", list.completedCount(),
                "failed", list.failedCount(),
                "cancelled", list.cancelledCount(),
                "progress", list.progressPercentage(),
                "totalCost", report.totalCost(),
                "durationMs", duration,
                "structuralErrors", problems.stream().map(StructuralProblem::describe).toList())));
        if (metrics != null) {
            metrics.recordTaskListResult(status);
        }
        log.info("Task list {} {} in {} ms ({}% complete, cost {})",
                list.id(), status, duration, list.progressPercentage(), report.totalCost());
        return report;
    }
}
