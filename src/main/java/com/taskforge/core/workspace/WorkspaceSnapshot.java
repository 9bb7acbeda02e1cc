package com.taskforge.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-modification content of every path one transaction has mutated, captured lazily
 * before the first write. A path that did not exist is recorded without content and is
 * deleted on restore.
 */
public class WorkspaceSnapshot {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSnapshot.class);

    /** relative path -> original bytes, or null when the path did not exist. */
    private final Map<String, byte[]> originals = new LinkedHashMap<>();

    /** Directories created on behalf of the transaction, outermost first. */
    private final List<Path> createdDirectories = new ArrayList<>();

    public boolean contains(String relativePath) {
        return originals.containsKey(relativePath);
    }

    /** Captures {@code file}'s current content unless the path was captured already. */
    public void capture(String relativePath, Path file) throws IOException {
        if (originals.containsKey(relativePath)) {
            return;
        }
        originals.put(relativePath, Files.isRegularFile(file) ? Files.readAllBytes(file) : null);
    }

    public void recordCreatedDirectory(Path directory) {
        createdDirectories.add(directory);
    }

    public boolean wasCreated(String relativePath) {
        return originals.containsKey(relativePath) && originals.get(relativePath) == null;
    }

    /** Original bytes of a snapshotted path, or null if the path did not exist. */
    public byte[] original(String relativePath) {
        byte[] bytes = originals.get(relativePath);
        return bytes == null ? null : bytes.clone();
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(originals.keySet());
    }

    public int size() {
        return originals.size();
    }

    /**
     * Writes every captured path back to its original state and removes directories the
     * transaction created, innermost first, when they are empty. Keeps going past
     * individual failures so that as much as possible is restored.
     *
     * @return the failures encountered, empty when the restore was complete
     */
    public List<IOException> restore(Path root) {
        var failures = new ArrayList<IOException>();
        originals.forEach((relative, bytes) -> {
            Path file = WorkspacePaths.resolve(root, relative);
            try {
                if (bytes == null) {
                    Files.deleteIfExists(file);
                } else {
                    Files.createDirectories(file.getParent());
                    Files.write(file, bytes);
                }
            } catch (IOException e) {
                log.error("Failed to restore {}: {}", relative, e.getMessage());
                failures.add(e);
            }
        });
        for (int i = createdDirectories.size() - 1; i >= 0; i--) {
            Path dir = createdDirectories.get(i);
            try {
                Files.deleteIfExists(dir);
            } catch (DirectoryNotEmptyException e) {
                log.debug("Keeping non-empty directory {}", dir);
            } catch (IOException e) {
                log.error("Failed to remove created directory {}: {}", dir, e.getMessage());
                failures.add(e);
            }
        }
        return failures;
    }

    public void discard() {
        originals.clear();
        createdDirectories.clear();
    }
}
