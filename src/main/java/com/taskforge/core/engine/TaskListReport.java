package com.taskforge.core.engine;

import com.taskforge.core.model.FailureKind;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.model.TaskStep;
import com.taskforge.core.model.TierAttempt;
import com.taskforge.core.scheduler.StructuralProblem;

import java.util.List;
import java.util.Optional;

/**
 * Final outcome of a task list run, with enough per-step detail to diagnose failures.
 *
 * @param taskListId       the list
 * @param title            the list's title
 * @param status           terminal status
 * @param structuralErrors problems that aborted the list, empty otherwise
 * @param steps            per-step outcome in declaration order
 * @param totalCost        sum of all steps' tier costs
 * @param durationMs       wall time of the run
 */
public record TaskListReport(
    String taskListId,
    String title,
    TaskListStatus status,
    List<StructuralProblem> structuralErrors,
    List<StepReport> steps,
    double totalCost,
    long durationMs
) {

    /**
     * @param stepId                 the step
     * @param status                 terminal status
     * @param failureKind            why it failed (null unless FAILED)
     * @param failureDetail          failure detail (null unless FAILED)
     * @param attemptCount           attempts across all tiers
     * @param tierHistory            every attempt in order
     * @param lastVerificationOutput output of the last verification run
     * @param result                 the step's result text
     * @param cost                   summed tier cost
     */
    public record StepReport(
        String stepId,
        StepStatus status,
        FailureKind failureKind,
        String failureDetail,
        int attemptCount,
        List<TierAttempt> tierHistory,
        String lastVerificationOutput,
        String result,
        double cost
    ) {

        static StepReport of(TaskStep step) {
            return new StepReport(step.id(), step.status(), step.failureKind(), step.failureDetail(),
                    step.attemptCount(), step.tierHistory(), step.lastVerificationOutput(), step.result(),
                    step.cost());
        }
    }

    public static TaskListReport of(TaskList list, List<StructuralProblem> problems, long durationMs) {
        var steps = list.steps().stream().map(StepReport::of).toList();
        double cost = steps.stream().mapToDouble(StepReport::cost).sum();
        return new TaskListReport(list.id(), list.title(), list.status(), List.copyOf(problems), steps,
                cost, durationMs);
    }

    public boolean succeeded() {
        return status == TaskListStatus.COMPLETED;
    }

    public Optional<StepReport> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }
}
