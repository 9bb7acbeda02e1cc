package com.taskforge.core.model;

/**
 * Lifecycle status of a task list.
 */
public enum TaskListStatus {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    PARTIALLY_COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != NOT_STARTED && this != RUNNING;
    }
}
