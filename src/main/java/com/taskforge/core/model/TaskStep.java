package com.taskforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A single schedulable, verifiable unit of work within a {@link TaskList}.
 *
 * <p>The definition fields are immutable. Execution state (status, tier history,
 * counters, diagnostics) is mutated by the executor pool and the step executor only,
 * and every accessor is synchronized so the scheduler thread always reads a
 * consistent value while a worker thread advances the step.
 */
public class TaskStep {

    private final String id;
    private final String description;
    private final StepCategory category;
    private final List<String> dependencies;
    private final List<String> declaredPaths;
    private final String verificationCommand;
    private final Tier minimumTier;

    private StepStatus status = StepStatus.PENDING;
    private final List<TierAttempt> tierHistory = new ArrayList<>();
    private final Set<String> discoveredPaths = new LinkedHashSet<>();
    private int attemptCount;
    private int softRetryCount;
    private int hardRetryCount;
    private double cost;
    private String lastVerificationOutput;
    private String failureDetail;
    private FailureKind failureKind;
    private String result;

    /**
     * @param id                  unique identifier within the task list (e.g. "1", "step_2")
     * @param description         natural-language instruction for the agent backend
     * @param category            kind of work; selects the default verification command
     * @param dependencies        ids of steps that must complete first
     * @param declaredPaths       files this step is expected to touch (may be empty)
     * @param verificationCommand command that must exit 0, or null for the category default
     * @param minimumTier         lowest tier allowed to run this step, or null for no constraint
     */
    public TaskStep(String id, String description, StepCategory category, List<String> dependencies,
                    List<String> declaredPaths, String verificationCommand, Tier minimumTier) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("step id cannot be empty");
        }
        this.id = id;
        this.description = description != null ? description : "";
        this.category = category != null ? category : StepCategory.FEATURE;
        this.dependencies = dependencies != null ? List.copyOf(new LinkedHashSet<>(dependencies)) : List.of();
        this.declaredPaths = declaredPaths != null ? List.copyOf(declaredPaths) : List.of();
        this.verificationCommand = verificationCommand != null && !verificationCommand.isBlank()
                ? verificationCommand : null;
        this.minimumTier = minimumTier;
    }

    public TaskStep(String id, String description, StepCategory category, List<String> dependencies) {
        this(id, description, category, dependencies, List.of(), null, null);
    }

    public String id() { return id; }
    public String description() { return description; }
    public StepCategory category() { return category; }
    public List<String> dependencies() { return dependencies; }
    public List<String> declaredPaths() { return declaredPaths; }
    public Tier minimumTier() { return minimumTier; }

    /** The explicit verification command, or null when the category default applies. */
    public String verificationCommand() { return verificationCommand; }

    public synchronized StepStatus status() {
        return status;
    }

    /**
     * Advances the step's state machine.
     *
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    public synchronized void transitionTo(StepStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Step " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    /** Like {@link #transitionTo} but silently ignores steps that are already terminal. */
    public synchronized boolean transitionIfNotTerminal(StepStatus next) {
        if (status.isTerminal()) {
            return false;
        }
        transitionTo(next);
        return true;
    }

    /**
     * Appends an attempt to the tier history.
     *
     * @throws IllegalStateException if the attempt's tier ranks below the previous attempt's tier
     */
    public synchronized void recordAttempt(TierAttempt attempt) {
        if (!tierHistory.isEmpty()) {
            Tier last = tierHistory.get(tierHistory.size() - 1).tier();
            if (last.isAbove(attempt.tier())) {
                throw new IllegalStateException("Step " + id + " cannot de-escalate from "
                        + last + " to " + attempt.tier());
            }
        }
        tierHistory.add(attempt);
    }

    public synchronized List<TierAttempt> tierHistory() {
        return List.copyOf(tierHistory);
    }

    /** Number of times the step moved to a higher tier. */
    public synchronized int escalationCount() {
        int count = 0;
        for (int i = 1; i < tierHistory.size(); i++) {
            if (tierHistory.get(i).tier().isAbove(tierHistory.get(i - 1).tier())) {
                count++;
            }
        }
        return count;
    }

    public synchronized int nextAttempt() {
        return ++attemptCount;
    }

    public synchronized int attemptCount() { return attemptCount; }

    public synchronized void incrementSoftRetries() { softRetryCount++; }
    public synchronized int softRetryCount() { return softRetryCount; }

    public synchronized void incrementHardRetries() { hardRetryCount++; }
    public synchronized int hardRetryCount() { return hardRetryCount; }

    public synchronized void addCost(double amount) { cost += amount; }
    public synchronized double cost() { return cost; }

    public synchronized void addDiscoveredPath(String path) { discoveredPaths.add(path); }

    public synchronized Set<String> discoveredPaths() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(discoveredPaths));
    }

    public synchronized void setLastVerificationOutput(String output) { lastVerificationOutput = output; }
    public synchronized String lastVerificationOutput() { return lastVerificationOutput; }

    public synchronized void setResult(String result) { this.result = result; }
    public synchronized String result() { return result; }

    public synchronized void setFailure(FailureKind kind, String detail) {
        this.failureKind = kind;
        this.failureDetail = detail;
    }

    public synchronized FailureKind failureKind() { return failureKind; }
    public synchronized String failureDetail() { return failureDetail; }

    /**
     * Creates a fresh copy of this step's definition for a new task list.
     * A completed step keeps its completed status and result; any other step restarts at PENDING.
     */
    /** A PENDING copy of the step definition with no execution history. */
    public TaskStep freshCopy() {
        return new TaskStep(id, description, category, dependencies, declaredPaths,
                verificationCommand, minimumTier);
    }

    public synchronized TaskStep copyForRetry() {
        var copy = new TaskStep(id, description, category, dependencies, declaredPaths,
                verificationCommand, minimumTier);
        if (status == StepStatus.COMPLETED) {
            copy.status = StepStatus.COMPLETED;
            copy.result = result;
        }
        return copy;
    }

    @Override
    public synchronized String toString() {
        return "TaskStep[" + id + ", " + category + ", " + status + "]";
    }
}
