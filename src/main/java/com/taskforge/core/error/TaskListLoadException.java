package com.taskforge.core.error;

/**
 * Thrown when a plan file cannot be read or parsed into a task list.
 */
public class TaskListLoadException extends RuntimeException {
    public TaskListLoadException(String message) {
        super(message);
    }

    public TaskListLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
