package com.taskforge.core.scheduler;

import java.util.List;

/**
 * One reason a task list cannot run to completion.
 *
 * @param kind   what is wrong
 * @param stepId the step the problem was found on (nullable for list-wide problems)
 * @param detail human-readable explanation; for cycles, the cycle path
 */
public record StructuralProblem(Kind kind, String stepId, String detail) {

    public enum Kind {
        UNKNOWN_DEPENDENCY,
        SELF_DEPENDENCY,
        CYCLE,
        INVALID_PATH,
        STALLED,
        DEPTH_EXCEEDED
    }

    public static StructuralProblem cycle(List<String> path) {
        return new StructuralProblem(Kind.CYCLE, path.get(0), "circular dependency: " + String.join(" -> ", path));
    }

    public String describe() {
        return stepId != null ? kind + " at step " + stepId + ": " + detail : kind + ": " + detail;
    }
}
