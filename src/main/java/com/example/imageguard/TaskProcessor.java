package com.example.imageguard;

/**
 * Runs one admitted task to a terminal state. Implementations report failures in the result instead of
 * throwing.
 */
@FunctionalInterface
public interface TaskProcessor {
    SanitizationResult process(FileTask task);
}
