package com.taskforge.core.workspace;

import com.taskforge.core.execution.CancellationToken;
import com.taskforge.core.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One step attempt's unit of file effects: locks, lazy snapshots, commit and rollback.
 * <p>
 * Lock acquisition happens outside this object's monitor so that a handle call blocked
 * on another step's lock never prevents {@link #rollback()} from running. Once the
 * transaction is closed, pending lock waits made through it are aborted and every
 * further handle call throws {@link IllegalStateException}.
 */
public class WorkspaceTransaction implements WorkspaceHandle, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceTransaction.class);

    /** Receives path-level events raised while the transaction runs. */
    public interface PathObserver {

        PathObserver NONE = path -> {};

        /** A path outside the declared set is about to be locked. */
        void firstTouch(String path);

        /** The path is currently locked by another owner. */
        default void contended(String path, String holder) {}
    }

    private enum State { OPEN, COMMITTED, ROLLED_BACK }

    private final Path root;
    private final FileLockManager lockManager;
    private final String owner;
    private final CancellationToken token;
    private final PathObserver observer;
    private final Map<String, FileLock> locks = new LinkedHashMap<>();
    private final WorkspaceSnapshot snapshot = new WorkspaceSnapshot();
    private volatile State state = State.OPEN;

    WorkspaceTransaction(Path root, FileLockManager lockManager, String owner,
                         CancellationToken parentToken, PathObserver observer) {
        this.root = root;
        this.lockManager = lockManager;
        this.owner = owner;
        this.token = parentToken.child();
        this.observer = observer != null ? observer : PathObserver.NONE;
    }

    void lockDeclared(Collection<String> declaredPaths) {
        var relative = new LinkedHashSet<String>();
        for (String p : declaredPaths) {
            relative.add(WorkspacePaths.toRelative(root, p));
        }
        List<FileLock> acquired = lockManager.acquireAll(owner, relative, token);
        synchronized (this) {
            for (FileLock lock : acquired) {
                locks.put(lock.path(), lock);
            }
        }
    }

    public String owner() {
        return owner;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean isCommitted() {
        return state == State.COMMITTED;
    }

    public boolean isRolledBack() {
        return state == State.ROLLED_BACK;
    }

    @Override
    public byte[] read(String path) throws IOException {
        String rel = touch(path);
        synchronized (this) {
            ensureOpen();
            return Files.readAllBytes(WorkspacePaths.resolve(root, rel));
        }
    }

    @Override
    public String readString(String path) throws IOException {
        return new String(read(path), StandardCharsets.UTF_8);
    }

    @Override
    public void write(String path, byte[] content) throws IOException {
        String rel = touch(path);
        synchronized (this) {
            ensureOpen();
            Path file = WorkspacePaths.resolve(root, rel);
            snapshot.capture(rel, file);
            createParentDirectories(file);
            Files.write(file, content);
            log.debug("{} wrote {} ({} bytes)", owner, rel, content.length);
        }
    }

    @Override
    public void writeString(String path, String content) throws IOException {
        write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean delete(String path) throws IOException {
        String rel = touch(path);
        synchronized (this) {
            ensureOpen();
            Path file = WorkspacePaths.resolve(root, rel);
            snapshot.capture(rel, file);
            boolean existed = Files.deleteIfExists(file);
            log.debug("{} deleted {} (existed={})", owner, rel, existed);
            return existed;
        }
    }

    @Override
    public boolean exists(String path) {
        String rel = touch(path);
        synchronized (this) {
            ensureOpen();
            return Files.exists(WorkspacePaths.resolve(root, rel));
        }
    }

    /** Paths currently locked by this transaction, declared ones first. */
    public synchronized Set<String> lockedPaths() {
        return Set.copyOf(locks.keySet());
    }

    /** Net effect of the transaction so far, relative to the snapshots. */
    public synchronized List<FileRecord> changes() {
        var records = new ArrayList<FileRecord>();
        for (String rel : snapshot.paths()) {
            byte[] original = snapshot.original(rel);
            Path file = WorkspacePaths.resolve(root, rel);
            boolean nowExists = Files.isRegularFile(file);
            if (original == null) {
                if (nowExists) {
                    records.add(new FileRecord(rel, FileRecord.CREATED));
                }
            } else if (!nowExists) {
                records.add(new FileRecord(rel, FileRecord.DELETED));
            } else if (!sameContent(file, original)) {
                records.add(new FileRecord(rel, FileRecord.MODIFIED));
            }
        }
        return records;
    }

    /**
     * Keeps all changes and releases the locks. Calling it again, or after a rollback,
     * has no effect.
     *
     * @return true if this call committed the transaction
     */
    public synchronized boolean commit() {
        if (state != State.OPEN) {
            log.debug("Commit of {} ignored: already {}", owner, state);
            return false;
        }
        state = State.COMMITTED;
        log.debug("{} committed {} path(s)", owner, snapshot.size());
        snapshot.discard();
        closeLocks("transaction committed");
        return true;
    }

    /**
     * Restores every snapshotted path, deletes files this transaction created and releases
     * the locks. Calling it again, or after a commit, has no effect.
     *
     * @return true if this call rolled the transaction back
     * @throws UncheckedIOException if some path could not be restored; locks are released regardless
     */
    public synchronized boolean rollback() {
        if (state != State.OPEN) {
            log.debug("Rollback of {} ignored: already {}", owner, state);
            return false;
        }
        state = State.ROLLED_BACK;
        List<IOException> failures;
        try {
            failures = snapshot.restore(root);
            log.debug("{} rolled back {} path(s)", owner, snapshot.size());
            snapshot.discard();
        } finally {
            closeLocks("transaction rolled back");
        }
        if (!failures.isEmpty()) {
            var error = new UncheckedIOException("Rollback of " + owner + " incomplete", failures.get(0));
            failures.stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }
        return true;
    }

    /** Rolls back if still open. */
    @Override
    public void close() {
        if (isOpen()) {
            rollback();
        }
    }

    /** Locks the path on first touch and returns its root-relative form. */
    private String touch(String path) {
        String rel = WorkspacePaths.toRelative(root, path);
        ensureOpen();
        synchronized (this) {
            if (locks.containsKey(rel)) {
                return rel;
            }
        }
        lockManager.holderOf(rel)
                .filter(holder -> !holder.equals(owner))
                .ifPresent(holder -> observer.contended(rel, holder));
        observer.firstTouch(rel);
        FileLock lock = lockManager.acquire(owner, rel, token);
        synchronized (this) {
            if (state != State.OPEN) {
                lock.close();
                throw new IllegalStateException("Transaction " + owner + " is already " + state);
            }
            if (locks.putIfAbsent(rel, lock) != null) {
                lock.close();
            }
        }
        return rel;
    }

    private void ensureOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Transaction " + owner + " is already " + state);
        }
    }

    private void createParentDirectories(Path file) throws IOException {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        var missing = new ArrayDeque<Path>();
        for (Path dir = file.getParent(); dir != null && !dir.equals(absoluteRoot) && !Files.exists(dir);
             dir = dir.getParent()) {
            missing.push(dir);
        }
        while (!missing.isEmpty()) {
            Path dir = missing.pop();
            Files.createDirectory(dir);
            snapshot.recordCreatedDirectory(dir);
        }
    }

    private void closeLocks(String reason) {
        token.cancel(reason);
        locks.values().forEach(FileLock::close);
        locks.clear();
    }

    private static boolean sameContent(Path file, byte[] original) {
        try {
            return Arrays.equals(Files.readAllBytes(file), original);
        } catch (IOException e) {
            return false;
        }
    }
}
