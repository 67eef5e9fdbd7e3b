package com.example.imageguard;

/**
 * A per-file failure that moves the task to the Failed state.
 */
public class SanitizationException extends Exception {
    private final FailureReason reason;

    public SanitizationException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SanitizationException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason reason() {
        return reason;
    }
}
