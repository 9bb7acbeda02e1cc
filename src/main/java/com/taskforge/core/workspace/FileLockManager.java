package com.taskforge.core.workspace;

import com.taskforge.core.error.LockOrderViolationException;
import com.taskforge.core.execution.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-path exclusive locks shared by every step touching the workspace.
 * <p>
 * Locks are re-entrant per owner (an owner is one step of one task list). A blocked
 * acquisition waits on the manager's monitor and wakes up at least every
 * {@code pollMillis} to observe cancellation. Before waiting, the manager walks the
 * wait-for graph; if the wait would close a cycle the request fails with a
 * {@link LockOrderViolationException} instead of deadlocking.
 */
public class FileLockManager {

    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);

    private final long pollMillis;
    private final Object monitor = new Object();

    /** path -> current holder. */
    private final Map<String, Holder> holders = new HashMap<>();

    /** owner -> path it is currently waiting for. */
    private final Map<String, String> waiting = new HashMap<>();

    private final List<LockListener> listeners = new CopyOnWriteArrayList<>();

    public FileLockManager(long pollMillis) {
        if (pollMillis <= 0) {
            throw new IllegalArgumentException("pollMillis must be positive");
        }
        this.pollMillis = pollMillis;
    }

    public FileLockManager() {
        this(50);
    }

    public void addListener(LockListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LockListener listener) {
        listeners.remove(listener);
    }

    /**
     * Acquires the lock on {@code path} for {@code owner}, blocking while another owner holds it.
     *
     * @throws LockOrderViolationException if waiting would deadlock
     * @throws CancellationException       if the token is cancelled while waiting
     */
    public FileLock acquire(String owner, String path, CancellationToken token) {
        String key = WorkspacePaths.normalize(path);
        long waitStart = 0;
        synchronized (monitor) {
            try {
                while (true) {
                    token.throwIfCancelled();
                    Holder holder = holders.get(key);
                    if (holder == null) {
                        holders.put(key, new Holder(owner));
                        notifyAcquired(owner, key, waitStart);
                        return new FileLock(this, owner, key);
                    }
                    if (holder.owner.equals(owner)) {
                        holder.count++;
                        return new FileLock(this, owner, key);
                    }
                    if (closesCycle(owner, holder.owner)) {
                        String message = "Lock request by " + owner + " on " + key
                                + " would deadlock with " + holder.owner;
                        String dump = describeOwnership();
                        log.error("{}\n{}", message, dump);
                        throw new LockOrderViolationException(message, dump);
                    }
                    if (waitStart == 0) {
                        waitStart = System.nanoTime();
                        waiting.put(owner, key);
                        log.debug("{} waiting for {} held by {}", owner, key, holder.owner);
                    }
                    monitor.wait(pollMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for lock on " + key);
            } finally {
                waiting.remove(owner);
            }
        }
    }

    /**
     * Acquires locks on all paths in lexicographic order. On failure, locks already taken
     * by this call are released before the exception propagates.
     */
    public List<FileLock> acquireAll(String owner, Collection<String> paths, CancellationToken token) {
        var sorted = new TreeSet<String>();
        for (String p : paths) {
            sorted.add(WorkspacePaths.normalize(p));
        }
        var acquired = new ArrayList<FileLock>(sorted.size());
        try {
            for (String p : sorted) {
                acquired.add(acquire(owner, p, token));
            }
            return acquired;
        } catch (RuntimeException e) {
            acquired.forEach(FileLock::close);
            throw e;
        }
    }

    /** Current holder of a path, if any. */
    public Optional<String> holderOf(String path) {
        String key = WorkspacePaths.normalize(path);
        synchronized (monitor) {
            Holder holder = holders.get(key);
            return holder == null ? Optional.empty() : Optional.of(holder.owner);
        }
    }

    public boolean isLocked(String path) {
        return holderOf(path).isPresent();
    }

    /** Number of locked paths. */
    public int lockedCount() {
        synchronized (monitor) {
            return holders.size();
        }
    }

    void release(String owner, String path) {
        synchronized (monitor) {
            Holder holder = holders.get(path);
            if (holder == null || !holder.owner.equals(owner)) {
                log.warn("Release of {} by {} ignored: not the holder", path, owner);
                return;
            }
            if (--holder.count > 0) {
                return;
            }
            holders.remove(path);
            log.debug("{} released {}", owner, path);
            for (var listener : listeners) {
                listener.released(owner, path);
            }
            monitor.notifyAll();
        }
    }

    /** Snapshot of held and awaited locks, for diagnostics. */
    public String describeOwnership() {
        synchronized (monitor) {
            var sb = new StringBuilder("Lock ownership:");
            if (holders.isEmpty()) {
                sb.append(" none");
            }
            new TreeMap<>(holders).forEach((path, h) ->
                    sb.append("\n  ").append(path).append(" held by ").append(h.owner)
                            .append(h.count > 1 ? " (x" + h.count + ")" : ""));
            new TreeMap<>(waiting).forEach((owner, path) ->
                    sb.append("\n  ").append(owner).append(" waiting for ").append(path));
            return sb.toString();
        }
    }

    /** Follows holder -> awaited path -> holder links and reports whether they lead back to the requester. */
    private boolean closesCycle(String requester, String firstHolder) {
        var visited = new HashSet<String>();
        String current = firstHolder;
        while (current != null && visited.add(current)) {
            if (current.equals(requester)) {
                return true;
            }
            String awaited = waiting.get(current);
            if (awaited == null) {
                return false;
            }
            Holder next = holders.get(awaited);
            current = next == null ? null : next.owner;
        }
        return false;
    }

    private void notifyAcquired(String owner, String path, long waitStart) {
        log.debug("{} acquired {}", owner, path);
        for (var listener : listeners) {
            listener.acquired(owner, path);
            if (waitStart != 0) {
                listener.waited(owner, path, Duration.ofNanos(System.nanoTime() - waitStart));
            }
        }
    }

    private static final class Holder {
        private final String owner;
        private int count = 1;

        private Holder(String owner) {
            this.owner = owner;
        }
    }
}
