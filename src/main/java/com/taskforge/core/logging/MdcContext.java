package com.taskforge.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Taskforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_LIST_ID = "taskListId";
    public static final String STEP_ID = "stepId";
    public static final String TIER = "tier";
    public static final String ATTEMPT = "attempt";

    private MdcContext() {}

    public static void setTaskList(String taskListId) {
        MDC.put(TASK_LIST_ID, taskListId);
    }

    public static void setStep(String taskListId, String stepId) {
        MDC.put(TASK_LIST_ID, taskListId);
        MDC.put(STEP_ID, stepId);
    }

    public static void setAttempt(String tier, int attempt) {
        MDC.put(TIER, tier);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    /** Copy of the current MDC, for code that runs a nested task list on the same thread. */
    public static Map<String, String> snapshot() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy != null ? copy : Map.of();
    }

    public static void restore(Map<String, String> saved) {
        clear();
        saved.forEach(MDC::put);
    }

    public static void clear() {
        MDC.remove(TASK_LIST_ID);
        MDC.remove(STEP_ID);
        MDC.remove(TIER);
        MDC.remove(ATTEMPT);
    }
}
