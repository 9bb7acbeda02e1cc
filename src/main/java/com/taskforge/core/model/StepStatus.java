package com.taskforge.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an individual step within a task list.
 */
public enum StepStatus {
    PENDING,
    ELIGIBLE,
    LOCKED,
    EXECUTING,
    VERIFYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Dispatched to a worker and not yet terminal. */
    public boolean isInFlight() {
        return this == ELIGIBLE || this == LOCKED || this == EXECUTING || this == VERIFYING;
    }

    public boolean canTransitionTo(StepStatus next) {
        return allowedSuccessors().contains(next);
    }

    private Set<StepStatus> allowedSuccessors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ELIGIBLE, CANCELLED);
            // ELIGIBLE -> FAILED covers a lock request rejected before any lock was held
            case ELIGIBLE -> EnumSet.of(LOCKED, FAILED, CANCELLED);
            case LOCKED -> EnumSet.of(EXECUTING, FAILED, CANCELLED);
            // EXECUTING -> EXECUTING is a hard-failure retry that never reached verification
            case EXECUTING -> EnumSet.of(EXECUTING, VERIFYING, FAILED, CANCELLED);
            case VERIFYING -> EnumSet.of(EXECUTING, COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(StepStatus.class);
        };
    }
}
