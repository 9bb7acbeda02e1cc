package com.taskforge.core.execution;

import com.taskforge.core.context.ContextContribution;
import com.taskforge.core.context.ExecutionContext;
import com.taskforge.core.events.EngineEvents;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.model.FailureKind;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.scheduler.StructuralProblem;
import com.taskforge.core.scheduler.TaskGraph;
import com.taskforge.core.workspace.WorkspaceTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one task list's steps to terminal states under a concurrency bound.
 *
 * <p>The thread calling {@link #run} becomes the list's coordinator: it alone reads the
 * {@link TaskGraph}, dispatches eligible steps and merges their context contributions.
 * Workers never touch the graph; they report through a single message queue
 * ({@link StepFinished}, {@link PathDiscovered}, {@link ConflictDetected}), which the
 * coordinator processes in arrival order.
 *
 * <p>Each run gets its own worker threads so that a step blocked on a nested child list
 * never starves that child of workers.
 */
public class ExecutorPool {

    private static final Logger log = LoggerFactory.getLogger(ExecutorPool.class);

    private static final long INBOX_POLL_MILLIS = 100;

    private final StepExecutor stepExecutor;
    private final EventBus eventBus;
    private final int maxConcurrent;

    public ExecutorPool(StepExecutor stepExecutor, EventBus eventBus, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, was " + maxConcurrent);
        }
        this.stepExecutor = stepExecutor;
        this.eventBus = eventBus;
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * Final outcome of a pool run.
     *
     * @param status   terminal list status
     * @param problems structural problems that aborted the run, empty otherwise
     */
    public record Result(TaskListStatus status, List<StructuralProblem> problems) {}

    // -- worker -> coordinator messages --

    private interface Message {}

    private record StepFinished(StepResult result) implements Message {}

    private record PathDiscovered(String stepId, String path) implements Message {}

    private record ConflictDetected(String holderOwner, String stepId) implements Message {}

    /**
     * Runs every step of {@code list} to a terminal state. The list must already be RUNNING;
     * recording the terminal status is left to the caller.
     *
     * @param list           the task list
     * @param context        the list's execution context; contributions are merged into it
     * @param remainingDepth decomposition levels allowed to the list's steps
     * @param token          external cancellation
     * @param decomposition  runs child lists for decomposed steps
     */
    public Result run(TaskList list, ExecutionContext context, int remainingDepth,
                      CancellationToken token, DecompositionRunner decomposition) {
        var graph = TaskGraph.of(list);
        var problems = graph.validate();
        if (!problems.isEmpty()) {
            log.error("Task list {} is structurally invalid: {}", list.id(), problems);
            cancelPending(list, "structural error");
            return new Result(TaskListStatus.FAILED, problems);
        }
        for (var step : list.steps()) {
            if (step.status() == StepStatus.COMPLETED) {
                context.recordCarriedOver(step.id(), step.result());
            }
        }

        var coordinator = new Coordinator(list, graph, context, remainingDepth, token, decomposition);
        try {
            coordinator.loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Coordinator for {} interrupted; cancelling", list.id());
            coordinator.abandon();
        } finally {
            coordinator.workers.shutdownNow();
        }

        TaskListStatus status = finalStatus(list, token, coordinator.problems, coordinator.outrightFailure);
        log.info("Task list {} finished {}: {} completed, {} failed, {} cancelled",
                list.id(), status, list.completedCount(), list.failedCount(), list.cancelledCount());
        return new Result(status, List.copyOf(coordinator.problems));
    }

    /**
     * CANCELLED on external cancel; FAILED on a structural fault or an outright step failure
     * (see {@link StepResult#isOutrightFailure()}); COMPLETED when every step completed.
     * PARTIALLY_COMPLETED needs at least one cancelled step and no outright failure; anything
     * else is FAILED.
     */
    static TaskListStatus finalStatus(TaskList list, CancellationToken token,
                                      List<StructuralProblem> problems, boolean outrightFailure) {
        if (token.isCancelled()) {
            return TaskListStatus.CANCELLED;
        }
        if (!problems.isEmpty() || outrightFailure) {
            return TaskListStatus.FAILED;
        }
        if (list.completedCount() == list.steps().size()) {
            return TaskListStatus.COMPLETED;
        }
        if (list.cancelledCount() > 0) {
            return TaskListStatus.PARTIALLY_COMPLETED;
        }
        return TaskListStatus.FAILED;
    }

    /** Scheduling state of one run; confined to the coordinator thread. */
    private final class Coordinator {

        private final TaskList list;
        private final TaskGraph graph;
        private final ExecutionContext context;
        private final int remainingDepth;
        private final CancellationToken runToken;
        private final DecompositionRunner decomposition;
        private final BlockingQueue<Message> inbox = new LinkedBlockingQueue<>();
        private final Map<String, Future<?>> inFlight = new HashMap<>();
        private final List<StructuralProblem> problems = new ArrayList<>();
        private final ExecutorService workers;
        private boolean outrightFailure;

        Coordinator(TaskList list, TaskGraph graph, ExecutionContext context, int remainingDepth,
                    CancellationToken token, DecompositionRunner decomposition) {
            this.list = list;
            this.graph = graph;
            this.context = context;
            this.remainingDepth = remainingDepth;
            this.runToken = token.child();
            this.decomposition = decomposition;
            this.workers = Executors.newFixedThreadPool(maxConcurrent, workerFactory(list.id()));
        }

        void loop() throws InterruptedException {
            Message next = null;
            while (true) {
                for (; next != null; next = inbox.poll()) {
                    handle(next);
                }

                // Cancelling a step can block its own dependents, so repeat until nothing changes
                List<TaskStep> blocked;
                while (!(blocked = graph.blockedByFailure()).isEmpty()) {
                    for (var step : blocked) {
                        cancelStep(list, step, "dependency failed");
                        graph.markSettled(step.id());
                    }
                }

                if (runToken.isCancelled()) {
                    cancelPending(list, runToken.reason()).forEach(graph::markSettled);
                    if (inFlight.isEmpty()) {
                        return;
                    }
                } else {
                    if (graph.allTerminal() && inFlight.isEmpty()) {
                        return;
                    }
                    dispatch();
                    if (inFlight.isEmpty() && graph.hasPending()) {
                        var stall = graph.describeStall();
                        log.error("Task list {} stalled: {}", list.id(), stall.detail());
                        problems.add(stall);
                        runToken.cancel("stalled");
                        continue;
                    }
                }

                next = inbox.poll(INBOX_POLL_MILLIS, TimeUnit.MILLISECONDS);
            }
        }

        private void handle(Message message) {
            if (message instanceof StepFinished finished) {
                var result = finished.result();
                inFlight.remove(result.stepId());
                context.merge(result.contribution());
                graph.markSettled(result.stepId());
                if (result.isStructural()) {
                    problems.add(result.structuralProblem());
                    runToken.cancel("structural error in step " + result.stepId());
                }
                if (result.isOutrightFailure()) {
                    outrightFailure = true;
                }
            } else if (message instanceof PathDiscovered discovered) {
                graph.recordDiscoveredPath(discovered.stepId(), discovered.path());
                list.step(discovered.stepId()).ifPresent(s -> s.addDiscoveredPath(discovered.path()));
            } else if (message instanceof ConflictDetected conflict) {
                String prefix = list.id() + "/";
                if (conflict.holderOwner().startsWith(prefix)) {
                    graph.recordConflict(conflict.holderOwner().substring(prefix.length()), conflict.stepId());
                }
            }
        }

        private void dispatch() {
            for (TaskStep step : graph.eligibleSteps()) {
                if (inFlight.size() >= maxConcurrent) {
                    break;
                }
                step.transitionTo(StepStatus.ELIGIBLE);
                log.debug("Dispatching step {} ({} in flight)", step.id(), inFlight.size() + 1);
                eventBus.publish(EngineEvents.stepEvent(EngineEvents.STEP_ELIGIBLE, list.id(), step.id(),
                        EngineEvents.payload("description", step.description())));

                var run = new StepExecutor.StepRun(list.id(), step, context.view(), remainingDepth, runToken,
                        decomposition, observerFor(step));
                inFlight.put(step.id(), workers.submit(() -> {
                    StepResult result;
                    try {
                        result = stepExecutor.execute(run);
                    } catch (Throwable t) {
                        result = crashed(step, t);
                    }
                    inbox.add(new StepFinished(result));
                }));
            }
        }

        private WorkspaceTransaction.PathObserver observerFor(TaskStep step) {
            return new WorkspaceTransaction.PathObserver() {
                @Override
                public void firstTouch(String path) {
                    inbox.add(new PathDiscovered(step.id(), path));
                }

                @Override
                public void contended(String path, String holder) {
                    inbox.add(new ConflictDetected(holder, step.id()));
                }
            };
        }

        private StepResult crashed(TaskStep step, Throwable t) {
            log.error("Worker for step {} crashed: {}", step.id(), t.toString(), t);
            step.setFailure(FailureKind.INTERNAL, t.toString());
            step.transitionIfNotTerminal(StepStatus.FAILED);
            eventBus.publish(EngineEvents.stepEvent(EngineEvents.STEP_FAILED, list.id(), step.id(),
                    EngineEvents.payload("kind", FailureKind.INTERNAL.name(), "detail", t.toString())));
            return StepResult.failed(step.id(), FailureKind.INTERNAL, t.toString(),
                    new ContextContribution(step.id()), 0);
        }

        /** Cancels everything after the coordinator itself was interrupted. */
        void abandon() {
            runToken.cancel("interrupted");
            for (var entry : inFlight.entrySet()) {
                try {
                    entry.getValue().get(5, TimeUnit.SECONDS);
                } catch (Exception e) {
                    log.warn("Step {} did not stop cleanly: {}", entry.getKey(), e.toString());
                }
            }
            for (var step : list.steps()) {
                if (step.transitionIfNotTerminal(StepStatus.CANCELLED)) {
                    eventBus.publish(EngineEvents.stepEvent(EngineEvents.STEP_CANCELLED, list.id(), step.id(),
                            EngineEvents.payload("reason", "interrupted")));
                }
            }
        }
    }

    /** @return ids of the steps cancelled */
    private List<String> cancelPending(TaskList list, String reason) {
        var cancelled = new ArrayList<String>();
        for (var step : list.steps()) {
            if (step.status() == StepStatus.PENDING) {
                cancelStep(list, step, reason);
                cancelled.add(step.id());
            }
        }
        return cancelled;
    }

    private void cancelStep(TaskList list, TaskStep step, String reason) {
        step.transitionTo(StepStatus.CANCELLED);
        log.info("Step {} cancelled without running: {}", step.id(), reason);
        eventBus.publish(EngineEvents.stepEvent(EngineEvents.STEP_CANCELLED, list.id(), step.id(),
                EngineEvents.payload("reason", reason)));
    }

    private static ThreadFactory workerFactory(String listId) {
        var counter = new AtomicInteger();
        Map<String, String> mdc = MdcContext.snapshot();
        return r -> {
            Thread t = new Thread(() -> {
                MdcContext.restore(mdc);
                r.run();
            }, "taskforge-" + listId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
