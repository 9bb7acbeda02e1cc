package com.taskforge.core.workspace;

import com.taskforge.core.execution.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collection;

/**
 * Transactional view of the workspace directory. Every step attempt works through its own
 * {@link WorkspaceTransaction}; nothing in the engine writes to the root directly.
 */
public class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;
    private final FileLockManager lockManager;

    public Workspace(Path root, FileLockManager lockManager) {
        this.root = root.toAbsolutePath().normalize();
        this.lockManager = lockManager;
    }

    public Path root() {
        return root;
    }

    public FileLockManager lockManager() {
        return lockManager;
    }

    /**
     * Opens a transaction and locks the declared paths in sorted order.
     *
     * @param owner         lock owner key for the step attempt
     * @param declaredPaths paths to lock up front; further paths are locked on first touch
     * @param token         cancellation observed while waiting for locks
     * @param observer      notified of undeclared paths and contended locks
     */
    public WorkspaceTransaction begin(String owner, Collection<String> declaredPaths,
                                      CancellationToken token, WorkspaceTransaction.PathObserver observer) {
        var tx = new WorkspaceTransaction(root, lockManager, owner, token, observer);
        tx.lockDeclared(declaredPaths);
        log.debug("Opened transaction for {} with {} declared path(s)", owner, declaredPaths.size());
        return tx;
    }

    public WorkspaceTransaction begin(String owner, Collection<String> declaredPaths, CancellationToken token) {
        return begin(owner, declaredPaths, token, WorkspaceTransaction.PathObserver.NONE);
    }

    /** Root-relative form of a path, rejecting paths outside the root. */
    public String relativize(String path) {
        return WorkspacePaths.toRelative(root, path);
    }
}
