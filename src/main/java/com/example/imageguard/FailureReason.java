package com.example.imageguard;

/**
 * Why a task ended in the Failed state.
 */
public enum FailureReason {
    IO_ERROR,
    DECODE_ERROR,
    UNSUPPORTED_FORMAT,
    CAPABILITY_ERROR,
    BACKUP_ERROR
}
