package com.taskforge.core.model;

import java.io.Serializable;

/**
 * Tracks a single file change made inside a workspace transaction.
 *
 * @param path   path relative to the workspace root
 * @param action one of "created", "modified", "deleted"
 */
public record FileRecord(
    String path,
    String action
) implements Serializable {

    public static final String CREATED = "created";
    public static final String MODIFIED = "modified";
    public static final String DELETED = "deleted";
}
