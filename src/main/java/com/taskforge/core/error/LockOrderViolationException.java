package com.taskforge.core.error;

/**
 * Thrown by the file lock manager when granting a wait would close a cycle in the
 * wait-for graph. Fails the requesting step without retry.
 */
public class LockOrderViolationException extends RuntimeException {

    private final String ownershipDump;

    public LockOrderViolationException(String message, String ownershipDump) {
        super(message + "\n" + ownershipDump);
        this.ownershipDump = ownershipDump;
    }

    /** Who holds which path and who waits on whom at the time of detection. */
    public String ownershipDump() {
        return ownershipDump;
    }
}
