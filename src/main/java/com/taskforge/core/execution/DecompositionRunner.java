package com.taskforge.core.execution;

import com.taskforge.core.model.TaskList;
import com.taskforge.core.model.TaskListStatus;

/**
 * Runs the task list a step decomposed into, with the same protocol as a top-level list.
 */
@FunctionalInterface
public interface DecompositionRunner {

    /**
     * Runs {@code child} to a terminal state on the calling thread.
     *
     * @param child          the nested task list
     * @param parentListId   id of the list owning the decomposed step
     * @param parentStepId   id of the decomposed step
     * @param remainingDepth decomposition levels still allowed inside the child
     * @param token          cancelled when the parent is cancelled
     * @return the child's terminal status
     */
    TaskListStatus runChild(TaskList child, String parentListId, String parentStepId,
                            int remainingDepth, CancellationToken token);
}
