package com.taskforge.core.agent;

import com.taskforge.core.context.ContextView;
import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.Tier;
import com.taskforge.core.workspace.WorkspaceHandle;

import java.util.List;

/**
 * Everything an agent backend needs for one attempt at a step.
 *
 * @param taskListId          the task list the step belongs to
 * @param stepId              the step being attempted
 * @param description         the step's instruction
 * @param category            the step's category
 * @param tier                the tier this attempt runs on
 * @param attempt             1-based attempt number across all tiers
 * @param declaredPaths       paths the step is expected to touch
 * @param verificationCommand command that will judge the attempt
 * @param context             snapshot of what earlier steps did
 * @param feedback            verification failures of earlier attempts, oldest first
 * @param remainingDepth      how many more levels of decomposition are allowed
 * @param workspace           the only way to read and write files
 */
public record AgentRequest(
    String taskListId,
    String stepId,
    String description,
    StepCategory category,
    Tier tier,
    int attempt,
    List<String> declaredPaths,
    String verificationCommand,
    ContextView context,
    List<String> feedback,
    int remainingDepth,
    WorkspaceHandle workspace
) {

    public boolean decompositionAllowed() {
        return remainingDepth > 0;
    }

    public boolean isRetry() {
        return !feedback.isEmpty();
    }
}
