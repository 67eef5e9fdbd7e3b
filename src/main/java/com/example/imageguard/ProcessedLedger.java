package com.example.imageguard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable fingerprint → outcome map backed by a single JSON file.
 * <p>
 * Reads are lock-free; every mutation and the file write that follows it happen under the instance
 * monitor, so concurrent worker completions are linearized. Load and save problems are never fatal:
 * a missing or corrupt file yields an empty ledger and a failed save keeps the in-memory state.
 */
public final class ProcessedLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessedLedger.class);

    private final ObjectMapper mapper;
    private final Path ledgerPath;
    private final boolean retryFailed;
    private final Map<String, ProcessedRecord> records = new ConcurrentHashMap<>();

    private ProcessedLedger(Path ledgerPath, boolean retryFailed) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.ledgerPath = ledgerPath;
        this.retryFailed = retryFailed;
    }

    /**
     * Loads the ledger file once. Corrupt content is moved aside and replaced by an empty ledger.
     */
    public static ProcessedLedger open(Path ledgerPath, boolean retryFailed) {
        ProcessedLedger ledger = new ProcessedLedger(ledgerPath, retryFailed);
        ledger.load();
        return ledger;
    }

    private void load() {
        if (!Files.exists(ledgerPath)) {
            LOGGER.info("No ledger at {}; starting empty", ledgerPath);
            return;
        }
        try (Reader reader = Files.newBufferedReader(ledgerPath)) {
            LedgerState state = mapper.readValue(reader, LedgerState.class);
            if (state != null && state.records() != null) {
                state.records().forEach((fingerprint, record) -> {
                    if (fingerprint != null && record != null && record.outcome() != null) {
                        records.put(fingerprint, record);
                    }
                });
            }
            LOGGER.info("Loaded {} ledger records from {}", records.size(), ledgerPath);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Ledger {} is unreadable; continuing with an empty ledger", ledgerPath, ex);
            records.clear();
            moveAside();
        }
    }

    private void moveAside() {
        Path aside = ledgerPath.resolveSibling(ledgerPath.getFileName() + ".corrupt-" + Instant.now().toEpochMilli());
        try {
            Files.move(ledgerPath, aside);
            LOGGER.warn("Corrupt ledger kept as {}", aside);
        } catch (IOException ex) {
            LOGGER.warn("Could not move corrupt ledger {} aside", ledgerPath, ex);
        }
    }

    public Optional<ProcessedRecord> lookup(String fingerprint) {
        return Optional.ofNullable(records.get(fingerprint));
    }

    /**
     * True when the fingerprint has an outcome that blocks automatic reprocessing. Failed records only
     * block when the retry policy is off.
     */
    public boolean isTerminal(String fingerprint) {
        ProcessedRecord record = records.get(fingerprint);
        if (record == null) {
            return false;
        }
        return !record.isFailed() || !retryFailed;
    }

    public synchronized void record(ProcessedRecord record) {
        records.put(record.fingerprint(), record);
        persist();
    }

    /**
     * Removes the record so the content is processed again when next seen.
     */
    public synchronized boolean clear(String fingerprint) {
        boolean removed = records.remove(fingerprint) != null;
        if (removed) {
            persist();
        }
        return removed;
    }

    public synchronized int clearFailed() {
        int before = records.size();
        records.values().removeIf(ProcessedRecord::isFailed);
        int removed = before - records.size();
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    public int size() {
        return records.size();
    }

    public Path path() {
        return ledgerPath;
    }

    private void persist() {
        LedgerState state = new LedgerState(LedgerState.CURRENT_VERSION, new HashMap<>(records));
        try {
            Path parent = ledgerPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = ledgerPath.resolveSibling(ledgerPath.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            try {
                Files.move(temp, ledgerPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, ledgerPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to save ledger {}; keeping {} records in memory", ledgerPath, records.size(), ex);
        }
    }
}
