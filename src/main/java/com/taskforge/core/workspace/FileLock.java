package com.taskforge.core.workspace;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped exclusive lock on one workspace path. Use with try-with-resources or keep it in
 * a transaction that closes it on every exit path; closing more than once has no effect.
 */
public final class FileLock implements AutoCloseable {

    private final FileLockManager manager;
    private final String owner;
    private final String path;
    private final AtomicBoolean released = new AtomicBoolean();

    FileLock(FileLockManager manager, String owner, String path) {
        this.manager = manager;
        this.owner = owner;
        this.path = path;
    }

    public String owner() { return owner; }
    public String path() { return path; }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release(owner, path);
        }
    }

    @Override
    public String toString() {
        return "FileLock[" + path + " held by " + owner + (isReleased() ? ", released" : "") + "]";
    }
}
