package com.example.imageguard;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Verbatim copy of a file taken before any in-place change. One per processing attempt.
 */
public record BackupRecord(
        Path originalPath,
        Path backupPath,
        Instant createdAt
) {
}
