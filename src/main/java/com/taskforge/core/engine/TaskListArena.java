package com.taskforge.core.engine;

import com.taskforge.core.model.TaskList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flat store of every task list the orchestrator has run, indexed by id. Nested lists
 * point to their parent by id only, so the decomposition tree is never held as object links.
 */
public class TaskListArena {

    private final Map<String, TaskList> lists = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a different list with the same id is already registered
     */
    public void register(TaskList list) {
        TaskList existing = lists.putIfAbsent(list.id(), list);
        if (existing != null && existing != list) {
            throw new IllegalStateException("Task list id already in use: " + list.id());
        }
    }

    public Optional<TaskList> get(String id) {
        return Optional.ofNullable(lists.get(id));
    }

    /** Lists created by decomposing steps of {@code parentListId}. */
    public List<TaskList> children(String parentListId) {
        var children = new ArrayList<TaskList>();
        for (var list : lists.values()) {
            if (parentListId.equals(list.parentListId())) {
                children.add(list);
            }
        }
        children.sort((a, b) -> a.id().compareTo(b.id()));
        return children;
    }

    /** Nesting level of a list: 0 for a top-level list. */
    public int depthOf(String id) {
        int depth = 0;
        TaskList current = lists.get(id);
        while (current != null && current.parentListId() != null) {
            depth++;
            current = lists.get(current.parentListId());
        }
        return depth;
    }

    public int size() {
        return lists.size();
    }
}
