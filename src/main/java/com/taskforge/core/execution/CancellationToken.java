package com.taskforge.core.execution;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, observed at every blocking point: lock waits,
 * backend calls and verification commands.
 * <p>
 * A child token is cancelled whenever its parent is, but cancelling a child leaves the
 * parent untouched. Workspace transactions use a child token so that closing one
 * transaction aborts only the lock waits made on its behalf.
 */
public class CancellationToken {

    private final CancellationToken parent;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile String reason;

    public CancellationToken() {
        this(null);
    }

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    /** A token that is never cancelled by anyone but its holder. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        return new CancellationToken(this);
    }

    /** @return true if this call flipped the token */
    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public boolean cancel() {
        return cancel("cancelled");
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public String reason() {
        if (cancelled.get()) {
            return reason;
        }
        return parent != null ? parent.reason() : null;
    }

    /**
     * @throws CancellationException if this token or any ancestor has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason());
        }
    }
}
