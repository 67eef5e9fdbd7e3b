package com.example.imageguard;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Ledger entry for one content fingerprint.
 */
public record ProcessedRecord(
        String fingerprint,
        Outcome outcome,
        FailureReason reason,
        String detail,
        String path,
        Instant processedAt
) {
    public enum Outcome {
        SUCCESS,
        FAILED
    }

    public static ProcessedRecord success(String fingerprint, String path, Instant processedAt) {
        return new ProcessedRecord(fingerprint, Outcome.SUCCESS, null, null, path, processedAt);
    }

    public static ProcessedRecord failed(String fingerprint,
                                         String path,
                                         FailureReason reason,
                                         String detail,
                                         Instant processedAt) {
        return new ProcessedRecord(fingerprint, Outcome.FAILED, reason, detail, path, processedAt);
    }

    @JsonIgnore
    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
