package com.taskforge.core.events;

import com.taskforge.core.model.TaskListStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Event type names and factory helpers.
 */
public final class EngineEvents {

    public static final String TASKLIST_STARTED = "tasklist.started";
    public static final String STEP_ELIGIBLE = "step.eligible";
    public static final String STEP_STARTED = "step.started";
    public static final String STEP_RETRIED = "step.retried";
    public static final String STEP_ESCALATED = "step.escalated";
    public static final String STEP_VERIFYING = "step.verifying";
    public static final String STEP_COMMITTED = "step.committed";
    public static final String STEP_ROLLED_BACK = "step.rolled_back";
    public static final String STEP_COMPLETED = "step.completed";
    public static final String STEP_FAILED = "step.failed";
    public static final String STEP_CANCELLED = "step.cancelled";
    public static final String TASKLIST_COMPLETED = "tasklist.completed";
    public static final String TASKLIST_PARTIALLY_COMPLETED = "tasklist.partially_completed";
    public static final String TASKLIST_FAILED = "tasklist.failed";
    public static final String TASKLIST_CANCELLED = "tasklist.cancelled";

    static final Set<String> TERMINAL_LIST_EVENTS = Set.of(
            TASKLIST_COMPLETED, TASKLIST_PARTIALLY_COMPLETED, TASKLIST_FAILED, TASKLIST_CANCELLED);

    private EngineEvents() {}

    public static EngineEvent listEvent(String type, String taskListId, Map<String, Object> payload) {
        return new EngineEvent(type, taskListId, null, payload, Instant.now());
    }

    public static EngineEvent stepEvent(String type, String taskListId, String stepId, Map<String, Object> payload) {
        return new EngineEvent(type, taskListId, stepId, payload, Instant.now());
    }

    public static EngineEvent stepEvent(String type, String taskListId, String stepId) {
        return stepEvent(type, taskListId, stepId, Map.of());
    }

    /** Terminal event type for a terminal list status. */
    public static String terminalType(TaskListStatus status) {
        return switch (status) {
            case COMPLETED -> TASKLIST_COMPLETED;
            case PARTIALLY_COMPLETED -> TASKLIST_PARTIALLY_COMPLETED;
            case FAILED -> TASKLIST_FAILED;
            case CANCELLED -> TASKLIST_CANCELLED;
            case NOT_STARTED, RUNNING -> throw new IllegalArgumentException("Not a terminal status: " + status);
        };
    }

    /** Builds a payload map that tolerates null values. */
    public static Map<String, Object> payload(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return map;
    }
}
