package com.taskforge.core.execution;

import com.taskforge.core.context.ContextContribution;
import com.taskforge.core.model.FailureKind;
import com.taskforge.core.model.StepStatus;
import com.taskforge.core.model.TaskListStatus;
import com.taskforge.core.scheduler.StructuralProblem;

/**
 * Terminal report of one step run, sent from the worker to the pool's coordinator.
 *
 * @param stepId            the step
 * @param status            COMPLETED, FAILED or CANCELLED
 * @param failureKind       why the step failed (null unless FAILED)
 * @param detail            result text, failure detail or cancellation reason
 * @param contribution      what the step adds to the shared execution context
 * @param structuralProblem set when the failure must abort the whole task list
 * @param childStatus       terminal status of the child list for a CHILD_FAILED step, null otherwise
 * @param durationMs        wall time of the run
 */
public record StepResult(
    String stepId,
    StepStatus status,
    FailureKind failureKind,
    String detail,
    ContextContribution contribution,
    StructuralProblem structuralProblem,
    TaskListStatus childStatus,
    long durationMs
) {

    public static StepResult completed(String stepId, String result, ContextContribution contribution, long durationMs) {
        return new StepResult(stepId, StepStatus.COMPLETED, null, result, contribution, null, null, durationMs);
    }

    public static StepResult failed(String stepId, FailureKind kind, String detail,
                                    ContextContribution contribution, long durationMs) {
        return new StepResult(stepId, StepStatus.FAILED, kind, detail, contribution, null, null, durationMs);
    }

    public static StepResult childFailed(String stepId, TaskListStatus childStatus, String detail,
                                         ContextContribution contribution, long durationMs) {
        return new StepResult(stepId, StepStatus.FAILED, FailureKind.CHILD_FAILED, detail, contribution,
                null, childStatus, durationMs);
    }

    public static StepResult structural(String stepId, StructuralProblem problem,
                                        ContextContribution contribution, long durationMs) {
        return new StepResult(stepId, StepStatus.FAILED, FailureKind.STRUCTURAL, problem.describe(),
                contribution, problem, null, durationMs);
    }

    public static StepResult cancelled(String stepId, String reason, ContextContribution contribution, long durationMs) {
        return new StepResult(stepId, StepStatus.CANCELLED, null, reason, contribution, null, null, durationMs);
    }

    public boolean isStructural() {
        return structuralProblem != null;
    }

    /**
     * Whether the step failed with every recovery option used up: retries exhausted on the
     * highest tier, a crash, a structural fault, or a child list that itself ended FAILED.
     * Such a failure fails the whole list.
     */
    public boolean isOutrightFailure() {
        if (status != StepStatus.FAILED || failureKind == null) {
            return false;
        }
        return switch (failureKind) {
            case EXHAUSTED, INTERNAL, STRUCTURAL -> true;
            case CHILD_FAILED -> childStatus == TaskListStatus.FAILED;
            default -> false;
        };
    }
}
