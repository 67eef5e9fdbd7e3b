package com.example.imageguard.capability;

/**
 * Raised by a cleaning capability when it cannot produce cleaned bytes.
 */
public class CapabilityException extends Exception {

    public enum Kind {
        UNSUPPORTED_FORMAT,
        DECODE_ERROR,
        FAILURE
    }

    private final Kind kind;

    public CapabilityException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CapabilityException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static CapabilityException unsupported(ImageFormat format, String phase) {
        return new CapabilityException(Kind.UNSUPPORTED_FORMAT, "No " + phase + " support for " + format);
    }
}
