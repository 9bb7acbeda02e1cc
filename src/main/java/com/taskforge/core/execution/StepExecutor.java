package com.taskforge.core.execution;

import com.taskforge.core.agent.AgentBackend;
import com.taskforge.core.agent.AgentBackends;
import com.taskforge.core.agent.AgentRequest;
import com.taskforge.core.agent.StepOutcome;
import com.taskforge.core.config.EngineProperties;
import com.taskforge.core.context.ContextContribution;
import com.taskforge.core.context.ContextView;
import com.taskforge.core.error.HardFailureException;
import com.taskforge.core.error.LockOrderViolationException;
import com.taskforge.core.events.EngineEvents;
import com.taskforge.core.events.EventBus;
import com.taskforge.core.logging.MdcContext;
import com.taskforge.core.metrics.EngineMetrics;
import com.taskforge.core.model.AttemptOutcome;
import com.taskforge.core.model.FailureKind;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.Tier;
import com.taskforge.core.model.TierAttempt;
import com.taskforge.core.routing.TierRouter;
import com.taskforge.core.scheduler.StructuralProblem;
import com.taskforge.core.verify.VerificationResult;
import com.taskforge.core.verify.VerificationRunner;
import com.taskforge.core.workspace.Workspace;
import com.taskforge.core.workspace.WorkspaceTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one step to a terminal state: lock, snapshot, execute, verify, then commit or roll
 * back, retrying and escalating as needed.
 *
 * <p>Retry policy, per tier:
 * <ul>
 *   <li>Hard failure (backend unreachable, timeout, malformed response, crash): retry at the
 *       same tier up to {@code max-retries} times, then escalate.</li>
 *   <li>Soft failure (verification exited non-zero): retry at the same tier with the failure
 *       output added to the request's feedback, up to {@code soft-retry-count} times, then
 *       escalate.</li>
 * </ul>
 * Both counters reset on escalation. Running out of retries on the highest tier fails the
 * step as {@link FailureKind#EXHAUSTED}.
 *
 * <p>Every attempt runs in its own workspace transaction, so a failed attempt leaves no trace
 * in the workspace. The backend call runs on a separate thread and is abandoned when it
 * exceeds the backend timeout or the run is cancelled.
 */
public class StepExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private static final long POLL_MILLIS = 20;

    private final Workspace workspace;
    private final AgentBackends backends;
    private final VerificationRunner verifier;
    private final TierRouter router;
    private final EngineProperties properties;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final ExecutorService backendExecutor;

    public StepExecutor(Workspace workspace, AgentBackends backends, VerificationRunner verifier,
                        TierRouter router, EngineProperties properties, EventBus eventBus,
                        EngineMetrics metrics) {
        this.workspace = workspace;
        this.backends = backends;
        this.verifier = verifier;
        this.router = router;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.backendExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "taskforge-backend-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Everything one step run needs besides the executor's own collaborators.
     *
     * @param taskListId          the list the step belongs to
     * @param step                the step; must be {@link StepStatus#ELIGIBLE}
     * @param context             snapshot of the list's execution context
     * @param remainingDepth      decomposition levels still allowed
     * @param token               cancelled on external cancel or when the list aborts
     * @param decompositionRunner runs a child list when the backend decomposes the step
     * @param pathObserver        told about undeclared and contended paths
     */
    public record StepRun(
        String taskListId,
        TaskStep step,
        ContextView context,
        int remainingDepth,
        CancellationToken token,
        DecompositionRunner decompositionRunner,
        WorkspaceTransaction.PathObserver pathObserver
    ) {

        /** Lock owner key; unique across nested lists. */
        public String owner() {
            return taskListId + "/" + step.id();
        }
    }

    /**
     * Runs the step. Never throws: every outcome, including crashes, becomes a {@link StepResult}.
     */
    public StepResult execute(StepRun run) {
        Map<String, String> savedMdc = MdcContext.snapshot();
        MdcContext.setStep(run.taskListId(), run.step().id());
        var attempts = new AttemptLoop(run);
        try {
            return attempts.run();
        } catch (CancellationException e) {
            return attempts.cancelled(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return attempts.cancelled("interrupted");
        } catch (RuntimeException e) {
            log.error("Step {} crashed: {}", run.step().id(), e.getMessage(), e);
            return attempts.fail(FailureKind.INTERNAL, e.toString());
        } finally {
            MdcContext.restore(savedMdc);
        }
    }

    @Override
    public void close() {
        backendExecutor.shutdownNow();
    }

    /** Mutable state of one step run; confined to the worker thread. */
    private final class AttemptLoop {

        private final StepRun run;
        private final TaskStep step;
        private final String listId;
        private final ContextContribution contribution;
        private final List<String> feedback = new ArrayList<>();
        private final String verificationCommand;
        private final long startMs = System.currentTimeMillis();
        private Tier tier;
        private int hardRetries;
        private int softRetries;
        private WorkspaceTransaction tx;
        private TaskListStatus childStatus;

        AttemptLoop(StepRun run) {
            this.run = run;
            this.step = run.step();
            this.listId = run.taskListId();
            this.contribution = new ContextContribution(step.id());
            this.verificationCommand = step.verificationCommand() != null
                    ? step.verificationCommand()
                    : properties.verificationCommandFor(step.category());
        }

        StepResult run() throws InterruptedException {
            tier = router.initialTier(step);
            while (true) {
                run.token().throwIfCancelled();
                int attempt = step.nextAttempt();
                long attemptStart = System.currentTimeMillis();
                MdcContext.setAttempt(tier.name().toLowerCase(), attempt);

                try {
                    tx = workspace.begin(run.owner(), step.declaredPaths(), run.token(), run.pathObserver());
                } catch (LockOrderViolationException e) {
                    record(attempt, AttemptOutcome.RESOURCE_ERROR, e.getMessage(), attemptStart);
                    return fail(FailureKind.RESOURCE, e.getMessage());
                }
                if (step.status() == StepStatus.ELIGIBLE) {
                    step.transitionTo(StepStatus.LOCKED);
                }
                step.transitionTo(StepStatus.EXECUTING);
                if (attempt == 1) {
                    log.info("Step {} started on {}: {}", step.id(), tier, step.description());
                    publish(EngineEvents.STEP_STARTED, EngineEvents.payload(
                            "tier", tier.name(), "attempt", attempt, "category", step.category().name()));
                }

                var request = new AgentRequest(listId, step.id(), step.description(), step.category(), tier,
                        attempt, step.declaredPaths(), verificationCommand, run.context(), List.copyOf(feedback),
                        run.remainingDepth(), tx);

                StepOutcome outcome;
                try {
                    outcome = callBackend(backends.forTier(tier), request);
                } catch (HardFailureException e) {
                    rollback();
                    record(attempt, AttemptOutcome.HARD_FAILURE, e.detail(), attemptStart);
                    log.warn("Step {} attempt {} on {} failed hard: {}", step.id(), attempt, tier, e.detail());
                    if (hardRetries < properties.getMaxRetries()) {
                        hardRetries++;
                        step.incrementHardRetries();
                        retried("hard", e.detail());
                        continue;
                    }
                    if (!escalate("hard")) {
                        return fail(FailureKind.EXHAUSTED, "hard failure on " + tier + ": " + e.detail());
                    }
                    continue;
                } catch (LockOrderViolationException e) {
                    rollback();
                    record(attempt, AttemptOutcome.RESOURCE_ERROR, e.getMessage(), attemptStart);
                    return fail(FailureKind.RESOURCE, e.getMessage());
                }
                outcome.findings().forEach(contribution::addFinding);

                if (outcome instanceof StepOutcome.Decomposition decomposition) {
                    rollback();
                    record(attempt, AttemptOutcome.DECOMPOSED, decomposition.summary(), attemptStart);
                    StepResult childFailure = runChild(decomposition, attempt);
                    if (childFailure != null) {
                        return childFailure;
                    }
                }

                step.transitionTo(StepStatus.VERIFYING);
                publish(EngineEvents.STEP_VERIFYING, EngineEvents.payload(
                        "command", verificationCommand, "tier", tier.name(), "attempt", attempt));
                VerificationResult verification = verifier.run(verificationCommand, workspace.root(),
                        properties.getVerificationTimeout(), run.token());

                if (verification.passed()) {
                    step.setLastVerificationOutput(verification.stdout());
                    if (!(outcome instanceof StepOutcome.Decomposition)) {
                        record(attempt, AttemptOutcome.SUCCEEDED, outcome.summary(), attemptStart);
                    }
                    return complete(outcome, verification);
                }

                String failureText = verification.failureText();
                step.setLastVerificationOutput(failureText);
                rollback();
                record(attempt, AttemptOutcome.SOFT_FAILURE,
                        "`" + verificationCommand + "` exited " + verification.exitCode(), attemptStart);
                log.warn("Step {} attempt {} on {} failed verification (exit {})",
                        step.id(), attempt, tier, verification.exitCode());
                feedback.add(failureText);
                if (softRetries < properties.getSoftRetryCount()) {
                    softRetries++;
                    step.incrementSoftRetries();
                    retried("soft", "verification exited " + verification.exitCode());
                    continue;
                }
                if (!escalate("soft")) {
                    return fail(FailureKind.EXHAUSTED, "verification still failing on " + tier + ":\n" + failureText);
                }
            }
        }

        /**
         * Runs the child list of a decomposition. Child ids live under
         * {@code <listId>.<stepId>.<attempt>}; a child named outside that namespace is run as a
         * fresh copy renamed into it, so retries and siblings never reuse a registered id.
         *
         * @return null when the child completed and the step should go on to verification,
         *         otherwise the step's terminal result
         */
        private StepResult runChild(StepOutcome.Decomposition decomposition, int attempt) {
            var child = namespaced(decomposition.childList(), listId + "." + step.id() + "." + attempt);
            if (run.remainingDepth() <= 0) {
                var problem = new StructuralProblem(StructuralProblem.Kind.DEPTH_EXCEEDED, step.id(),
                        "decomposition into " + child.id() + " requested with no depth left");
                log.error("Step {} requested decomposition past the depth limit", step.id());
                step.setFailure(FailureKind.STRUCTURAL, problem.describe());
                step.transitionTo(StepStatus.FAILED);
                publish(EngineEvents.STEP_FAILED, EngineEvents.payload(
                        "kind", FailureKind.STRUCTURAL.name(), "detail", problem.describe()));
                recordStepMetrics(StepStatus.FAILED);
                return StepResult.structural(step.id(), problem, contribution, elapsed());
            }
            log.info("Step {} decomposed into task list {} ({} steps, depth left {})",
                    step.id(), child.id(), child.steps().size(), run.remainingDepth() - 1);
            if (metrics != null) {
                metrics.recordDecomposition(run.remainingDepth());
            }
            childStatus = run.decompositionRunner()
                    .runChild(child, listId, step.id(), run.remainingDepth() - 1, run.token());
            run.token().throwIfCancelled();
            if (childStatus != TaskListStatus.COMPLETED) {
                return fail(FailureKind.CHILD_FAILED, "child task list " + child.id() + " finished " + childStatus);
            }
            contribution.addFinding("completed child task list " + child.id());
            return null;
        }

        private TaskList namespaced(TaskList child, String namespace) {
            if (child.id().equals(namespace) || child.id().startsWith(namespace + ".")) {
                return child;
            }
            log.debug("Renaming child task list {} into {}", child.id(), namespace);
            return child.freshCopy(namespace + "." + child.id());
        }

        private StepOutcome callBackend(AgentBackend backend, AgentRequest request) throws InterruptedException {
            Map<String, String> mdc = MdcContext.snapshot();
            Future<StepOutcome> future = backendExecutor.submit(() -> {
                MdcContext.restore(mdc);
                try {
                    return backend.execute(request);
                } finally {
                    MdcContext.clear();
                }
            });
            Duration timeout = properties.getBackendTimeout();
            long deadline = System.nanoTime() + timeout.toNanos();
            try {
                while (true) {
                    try {
                        StepOutcome outcome = future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                        if (outcome == null) {
                            throw new HardFailureException(HardFailureException.Reason.MALFORMED_RESPONSE,
                                    backend.name() + " returned no outcome");
                        }
                        return outcome;
                    } catch (TimeoutException e) {
                        if (run.token().isCancelled()) {
                            future.cancel(true);
                            throw new CancellationException(run.token().reason());
                        }
                        if (System.nanoTime() >= deadline) {
                            future.cancel(true);
                            throw new HardFailureException(HardFailureException.Reason.TIMEOUT,
                                    backend.name() + " did not respond within " + timeout.toSeconds() + "s");
                        }
                    }
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof HardFailureException hard) {
                    throw hard;
                }
                if (cause instanceof LockOrderViolationException violation) {
                    throw violation;
                }
                if (cause instanceof CancellationException cancelled) {
                    throw cancelled;
                }
                throw new HardFailureException(HardFailureException.Reason.BACKEND_ERROR,
                        backend.name() + " threw " + cause, cause);
            } catch (InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        }

        private StepResult complete(StepOutcome outcome, VerificationResult verification) {
            if (tx != null && tx.isOpen()) {
                var changes = tx.changes();
                var changed = new HashSet<String>();
                changes.forEach(c -> changed.add(c.path()));
                tx.lockedPaths().stream().filter(p -> !changed.contains(p)).sorted().forEach(contribution::addFileRead);
                contribution.addFilesChanged(changes);
                tx.commit();
                publish(EngineEvents.STEP_COMMITTED, EngineEvents.payload("files", changes.size()));
            }
            tx = null;
            String summary = outcome.summary();
            contribution.setResult(summary);
            contribution.setCommandOutput(verification.stdout());
            step.setResult(summary);
            step.transitionTo(StepStatus.COMPLETED);
            log.info("Step {} completed on {} after {} attempt(s)", step.id(), tier, step.attemptCount());
            publish(EngineEvents.STEP_COMPLETED, EngineEvents.payload(
                    "tier", tier.name(), "attempts", step.attemptCount(), "cost", step.cost()));
            recordStepMetrics(StepStatus.COMPLETED);
            return StepResult.completed(step.id(), summary, contribution, elapsed());
        }

        StepResult fail(FailureKind kind, String detail) {
            rollbackAfterFailure();
            step.setFailure(kind, detail);
            step.transitionIfNotTerminal(StepStatus.FAILED);
            contribution.setCommandOutput(step.lastVerificationOutput());
            log.error("Step {} failed ({}): {}", step.id(), kind, detail);
            publish(EngineEvents.STEP_FAILED, EngineEvents.payload(
                    "kind", kind.name(), "detail", detail, "tier", tier != null ? tier.name() : null));
            recordStepMetrics(StepStatus.FAILED);
            if (kind == FailureKind.CHILD_FAILED) {
                return StepResult.childFailed(step.id(), childStatus, detail, contribution, elapsed());
            }
            return StepResult.failed(step.id(), kind, detail, contribution, elapsed());
        }

        StepResult cancelled(String reason) {
            rollbackAfterFailure();
            step.transitionIfNotTerminal(StepStatus.CANCELLED);
            log.info("Step {} cancelled: {}", step.id(), reason);
            publish(EngineEvents.STEP_CANCELLED, EngineEvents.payload("reason", reason));
            recordStepMetrics(StepStatus.CANCELLED);
            return StepResult.cancelled(step.id(), reason, contribution, elapsed());
        }

        /** @return false when there is no higher tier */
        private boolean escalate(String reason) {
            var next = router.nextTier(tier);
            if (next.isEmpty()) {
                return false;
            }
            log.info("Step {} escalating {} -> {} after {} failures", step.id(), tier, next.get(), reason);
            publish(EngineEvents.STEP_ESCALATED, EngineEvents.payload(
                    "from", tier.name(), "to", next.get().name(), "reason", reason));
            if (metrics != null) {
                metrics.incrementEscalations(reason);
            }
            tier = next.get();
            hardRetries = 0;
            softRetries = 0;
            return true;
        }

        private void retried(String kind, String detail) {
            publish(EngineEvents.STEP_RETRIED, EngineEvents.payload(
                    "kind", kind, "tier", tier.name(), "detail", detail,
                    "retry", "hard".equals(kind) ? hardRetries : softRetries));
        }

        private void record(int attempt, AttemptOutcome outcome, String detail, long attemptStart) {
            step.recordAttempt(new TierAttempt(attempt, tier, outcome, detail,
                    System.currentTimeMillis() - attemptStart));
            step.addCost(router.cost(tier));
            if (metrics != null) {
                metrics.recordAttempt(tier, outcome);
            }
        }

        private void rollback() {
            if (tx != null && tx.isOpen()) {
                if (tx.rollback()) {
                    publish(EngineEvents.STEP_ROLLED_BACK, EngineEvents.payload("tier", tier.name()));
                    if (metrics != null) {
                        metrics.recordRollback();
                    }
                }
            }
            tx = null;
        }

        /** Rollback on a path that already ends the step; a rollback error is logged with the step's failure. */
        private void rollbackAfterFailure() {
            try {
                rollback();
            } catch (RuntimeException e) {
                log.error("Rollback of step {} failed; workspace may hold partial changes: {}",
                        step.id(), e.getMessage(), e);
                contribution.addFinding("rollback failed: " + e.getMessage());
            }
        }

        private void recordStepMetrics(StepStatus status) {
            if (metrics != null) {
                metrics.recordStepDuration(tier, status, elapsed());
                metrics.recordStepCost(step.cost());
            }
        }

        private void publish(String type, Map<String, Object> payload) {
            eventBus.publish(EngineEvents.stepEvent(type, listId, step.id(), payload));
        }

        private long elapsed() {
            return System.currentTimeMillis() - startMs;
        }
    }
}
