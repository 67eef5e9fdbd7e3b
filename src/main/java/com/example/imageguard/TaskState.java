package com.example.imageguard;

/**
 * Per-task sanitization states. COMMITTED and FAILED are terminal.
 */
public enum TaskState {
    PENDING,
    BACKED_UP,
    METADATA_CLEANED,
    PIXEL_CLEANED,
    COMMITTED,
    FAILED
}
