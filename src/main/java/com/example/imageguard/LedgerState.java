package com.example.imageguard;

import java.util.Map;

/**
 * Serializable ledger payload.
 */
public record LedgerState(
        int version,
        Map<String, ProcessedRecord> records
) {
    public static final int CURRENT_VERSION = 1;
}
