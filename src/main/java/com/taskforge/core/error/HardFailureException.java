package com.taskforge.core.error;

/**
 * Thrown when an agent backend fails to produce a usable outcome.
 * Hard failures are retried at the same tier and escalated once retries run out.
 */
public class HardFailureException extends RuntimeException {

    public enum Reason {
        UNREACHABLE,
        TIMEOUT,
        MALFORMED_RESPONSE,
        BACKEND_ERROR
    }

    private final Reason reason;

    public HardFailureException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HardFailureException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /** Short diagnostic form stored in a step's tier history. */
    public String detail() {
        return reason + ": " + getMessage();
    }
}
