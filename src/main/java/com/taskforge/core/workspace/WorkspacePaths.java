package com.taskforge.core.workspace;

import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Path normalization shared by the scheduler (conflict checks) and the workspace
 * (file access). All paths are compared in root-relative, forward-slash form.
 */
public final class WorkspacePaths {

    private WorkspacePaths() {}

    /**
     * Lexical normalization: unifies separators, drops {@code .} segments, duplicate and
     * trailing slashes. Does not touch the file system.
     *
     * @throws IllegalArgumentException for blank paths or paths containing {@code ..}
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be empty");
        }
        String unified = path.trim().replace('\\', '/');
        boolean absolute = unified.startsWith("/");
        var parts = new ArrayList<String>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Path escapes the workspace: " + path);
            }
            parts.add(segment);
        }
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Path does not name a file: " + path);
        }
        String joined = String.join("/", parts);
        return absolute ? "/" + joined : joined;
    }

    /**
     * Converts a path given by a step or an agent into root-relative form.
     * Absolute paths are accepted only when they lie inside {@code root}.
     *
     * @throws IllegalArgumentException if the path escapes the root
     */
    public static String toRelative(Path root, String path) {
        String normalized = normalize(path);
        if (!normalized.startsWith("/")) {
            return normalized;
        }
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path candidate = Path.of(normalized).normalize();
        if (!candidate.startsWith(absoluteRoot) || candidate.equals(absoluteRoot)) {
            throw new IllegalArgumentException("Path outside workspace root " + absoluteRoot + ": " + path);
        }
        return normalize(absoluteRoot.relativize(candidate).toString());
    }

    /** Resolves a root-relative path against the root, re-checking containment. */
    public static Path resolve(Path root, String relative) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path resolved = absoluteRoot.resolve(relative).normalize();
        if (!resolved.startsWith(absoluteRoot)) {
            throw new IllegalArgumentException("Path outside workspace root " + absoluteRoot + ": " + relative);
        }
        return resolved;
    }

    /** Normalizes without throwing; returns the trimmed input when it cannot be normalized. */
    public static String normalizeLenient(String path) {
        try {
            return normalize(path);
        } catch (IllegalArgumentException e) {
            return path == null ? "" : path.trim();
        }
    }
}
