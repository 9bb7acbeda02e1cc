package com.taskforge.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress notification emitted while a task list executes.
 *
 * @param eventType  one of the {@link EngineEvents} type names (e.g. "step.started")
 * @param taskListId the task list this event belongs to
 * @param stepId     the step this event relates to (nullable for list-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record EngineEvent(
    String eventType,
    String taskListId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public boolean isTaskListTerminal() {
        return EngineEvents.TERMINAL_LIST_EVENTS.contains(eventType);
    }
}
