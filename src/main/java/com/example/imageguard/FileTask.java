package com.example.imageguard;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A candidate file on its way through admission and sanitization. The fingerprint stays null until
 * admission (or the scanner) computes it.
 */
public record FileTask(
        Path path,
        String fingerprint,
        Instant enqueuedAt,
        Source source
) {
    public enum Source {
        EVENT,
        SCAN
    }

    public FileTask {
        path = path.toAbsolutePath().normalize();
    }

    public static FileTask fromEvent(Path path) {
        return new FileTask(path, null, Instant.now(), Source.EVENT);
    }

    public static FileTask fromScan(Path path, String fingerprint) {
        return new FileTask(path, fingerprint, Instant.now(), Source.SCAN);
    }

    public FileTask withFingerprint(String value) {
        return new FileTask(path, value, enqueuedAt, source);
    }
}
