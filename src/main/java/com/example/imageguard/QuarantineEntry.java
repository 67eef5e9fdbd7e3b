package com.example.imageguard;

import com.example.imageguard.capability.DetectionParameters;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A failed file preserved in the quarantine area, paired with its JSON error report.
 */
public record QuarantineEntry(
        Path originalPath,
        Path quarantinedPath,
        Path reportPath,
        FailureReason reason,
        String detail,
        Instant failedAt
) {

    /**
     * JSON body of the error report written next to the quarantined copy.
     */
    public record Report(
            String originalPath,
            String quarantinedPath,
            FileTask.Source source,
            FailureReason reason,
            String detail,
            String fingerprint,
            Instant failedAt,
            DetectionParameters detection
    ) {
    }
}
