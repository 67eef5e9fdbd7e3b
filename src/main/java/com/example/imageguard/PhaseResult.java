package com.example.imageguard;

/**
 * Outcome of one cleaning phase. A skipped phase is a legitimate pass-through and is kept apart from a
 * failed one.
 */
public final class PhaseResult {
    public enum Kind {
        APPLIED,
        SKIPPED,
        FAILED
    }

    private final Kind kind;
    private final byte[] bytes;
    private final String reason;
    private final SanitizationException error;

    private PhaseResult(Kind kind, byte[] bytes, String reason, SanitizationException error) {
        this.kind = kind;
        this.bytes = bytes;
        this.reason = reason;
        this.error = error;
    }

    public static PhaseResult applied(byte[] bytes) {
        return new PhaseResult(Kind.APPLIED, bytes, null, null);
    }

    public static PhaseResult skipped(String reason) {
        return new PhaseResult(Kind.SKIPPED, null, reason, null);
    }

    public static PhaseResult failed(SanitizationException error) {
        return new PhaseResult(Kind.FAILED, null, error.getMessage(), error);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isApplied() {
        return kind == Kind.APPLIED;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    /**
     * Output bytes; only present for {@link Kind#APPLIED}.
     */
    public byte[] bytes() {
        return bytes;
    }

    public String reason() {
        return reason;
    }

    public SanitizationException error() {
        return error;
    }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind + "(" + reason + ")";
    }
}
