package com.example.imageguard;

/**
 * Totals for one folder scan.
 */
public record ScanSummary(
        long filesSeen,
        long enqueued,
        long skippedProcessed,
        long skippedFiltered,
        long unreadable,
        boolean cancelled
) {
}
