package com.taskforge.core.model;

/**
 * Why a step ended {@link StepStatus#FAILED}.
 */
public enum FailureKind {
    /** Every retry at every reachable tier was used up. */
    EXHAUSTED,
    /** Lock acquisition would have deadlocked; fatal for the step only. */
    RESOURCE,
    /** A decomposed child task list did not complete. */
    CHILD_FAILED,
    /** Decomposition requested with no depth left; aborts the owning task list. */
    STRUCTURAL,
    /** The worker crashed outside the retry loop. */
    INTERNAL
}
