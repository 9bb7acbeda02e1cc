package com.taskforge.core.workspace;

import java.io.IOException;

/**
 * The only way an agent backend touches files. Every call locks the path on first
 * touch and every mutation is snapshotted so it can be rolled back.
 * <p>
 * Paths are relative to the workspace root (absolute paths inside the root are accepted).
 */
public interface WorkspaceHandle {

    byte[] read(String path) throws IOException;

    String readString(String path) throws IOException;

    void write(String path, byte[] content) throws IOException;

    void writeString(String path, String content) throws IOException;

    /** @return true if the file existed */
    boolean delete(String path) throws IOException;

    boolean exists(String path);
}
