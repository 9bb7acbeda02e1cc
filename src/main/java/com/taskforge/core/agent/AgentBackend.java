package com.taskforge.core.agent;

import com.taskforge.core.error.HardFailureException;

/**
 * Turns a step description into file edits, a textual result or a nested task list.
 * Implementations may block; the step executor bounds every call with a timeout.
 */
public interface AgentBackend {

    /**
     * @throws HardFailureException when no usable outcome could be produced. Any other
     *                              runtime exception is treated as a backend error.
     */
    StepOutcome execute(AgentRequest request);

    String name();
}
