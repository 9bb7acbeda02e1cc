package com.taskforge.core.agent;

import java.util.List;

/**
 * Converts an {@link AgentRequest} into the instruction text handed to an agent.
 * Pure function, no Spring dependencies.
 */
public final class InstructionBuilder {

    /** Verification output kept per failed attempt. The tail is preserved since errors usually end there. */
    static final int MAX_FEEDBACK_CHARS = 4_000;

    private InstructionBuilder() {}

    public static String build(AgentRequest request) {
        var sb = new StringBuilder();

        sb.append("# Step: ").append(request.stepId()).append("\n\n");
        sb.append("## Objective\n\n");
        sb.append(request.description()).append("\n\n");

        if (!request.declaredPaths().isEmpty()) {
            sb.append("## Files\n\n");
            for (String path : request.declaredPaths()) {
                sb.append("- ").append(path).append("\n");
            }
            sb.append("\n");
        }

        String context = request.context().render();
        if (!context.isBlank()) {
            sb.append("## Context From Earlier Steps\n\n");
            sb.append(context).append("\n");
        }

        if (request.isRetry()) {
            List<String> feedback = request.feedback();
            sb.append("## Previous Attempt Failed Verification\n\n");
            sb.append("Verification command `").append(request.verificationCommand())
              .append("` failed. Fix the errors below.\n\n");
            sb.append("```\n").append(tail(feedback.get(feedback.size() - 1))).append("\n```\n\n");
            if (feedback.size() > 1) {
                sb.append("(").append(feedback.size() - 1).append(" earlier failure(s) omitted)\n\n");
            }
        }

        sb.append("## Success Criteria\n\n");
        sb.append("- `").append(request.verificationCommand()).append("` exits with status 0\n");
        if (request.decompositionAllowed()) {
            sb.append("- If the objective is too large, you may return subtasks instead of edits\n");
        }
        return sb.toString();
    }

    static String tail(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= MAX_FEEDBACK_CHARS) {
            return text;
        }
        return "...[truncated]...\n" + text.substring(text.length() - MAX_FEEDBACK_CHARS);
    }
}
