package com.taskforge.core.workspace;

import java.time.Duration;

/**
 * Observer of lock traffic in a {@link FileLockManager}. Callbacks run while the
 * manager's monitor is held, so they see acquisitions and releases in their true
 * order and must return quickly.
 */
public interface LockListener {

    void acquired(String owner, String path);

    void released(String owner, String path);

    /** Called once an owner obtains a lock it had to wait for. */
    default void waited(String owner, String path, Duration waited) {}
}
