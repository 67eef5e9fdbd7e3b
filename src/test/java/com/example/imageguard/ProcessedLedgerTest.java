package com.example.imageguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessedLedgerTest {

    @Test
    void recordsSurviveReopen() throws Exception {
        Path file = Files.createTempDirectory("ledger").resolve("nested").resolve("processed.json");
        ProcessedLedger ledger = ProcessedLedger.open(file, false);
        ledger.record(ProcessedRecord.success("aaa", "/photos/a.png", Instant.now()));
        ledger.record(ProcessedRecord.failed("bbb", "/photos/b.png", FailureReason.DECODE_ERROR, "truncated", Instant.now()));

        ProcessedLedger reopened = ProcessedLedger.open(file, false);

        assertEquals(2, reopened.size());
        assertEquals(ProcessedRecord.Outcome.SUCCESS, reopened.lookup("aaa").orElseThrow().outcome());
        ProcessedRecord failed = reopened.lookup("bbb").orElseThrow();
        assertEquals(FailureReason.DECODE_ERROR, failed.reason());
        assertEquals("truncated", failed.detail());
        assertFalse(Files.exists(file.resolveSibling("processed.json.tmp")));
    }

    @Test
    void failedRecordsAreTerminalUnlessRetryIsEnabled() throws Exception {
        Path file = Files.createTempDirectory("ledger").resolve("processed.json");
        ProcessedLedger strict = ProcessedLedger.open(file, false);
        strict.record(ProcessedRecord.failed("bad", "/x.png", FailureReason.IO_ERROR, "gone", Instant.now()));
        strict.record(ProcessedRecord.success("good", "/y.png", Instant.now()));

        ProcessedLedger retrying = ProcessedLedger.open(file, true);

        assertTrue(strict.isTerminal("bad"));
        assertTrue(strict.isTerminal("good"));
        assertFalse(retrying.isTerminal("bad"));
        assertTrue(retrying.isTerminal("good"));
        assertFalse(strict.isTerminal("unknown"));
    }

    @Test
    void corruptFileStartsEmptyAndIsMovedAside() throws Exception {
        Path dir = Files.createTempDirectory("ledger");
        Path file = Files.writeString(dir.resolve("processed.json"), "{ not json");

        ProcessedLedger ledger = ProcessedLedger.open(file, false);

        assertEquals(0, ledger.size());
        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.anyMatch(path -> path.getFileName().toString().startsWith("processed.json.corrupt-")));
        }
        ledger.record(ProcessedRecord.success("fresh", "/z.png", Instant.now()));
        assertEquals(1, ProcessedLedger.open(file, false).size());
    }

    @Test
    void clearFailedKeepsSuccesses() throws Exception {
        Path file = Files.createTempDirectory("ledger").resolve("processed.json");
        ProcessedLedger ledger = ProcessedLedger.open(file, false);
        ledger.record(ProcessedRecord.success("ok", "/a.png", Instant.now()));
        ledger.record(ProcessedRecord.failed("f1", "/b.png", FailureReason.DECODE_ERROR, "x", Instant.now()));
        ledger.record(ProcessedRecord.failed("f2", "/c.png", FailureReason.BACKUP_ERROR, "y", Instant.now()));

        assertEquals(2, ledger.clearFailed());
        assertTrue(ledger.clear("ok"));
        assertFalse(ledger.clear("ok"));
        assertEquals(0, ProcessedLedger.open(file, false).size());
    }

    @Test
    void concurrentWritersAllLand() throws Exception {
        Path file = Files.createTempDirectory("ledger").resolve("processed.json");
        ProcessedLedger ledger = ProcessedLedger.open(file, false);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String fingerprint = "fp-" + i;
            futures.add(pool.submit(() -> ledger.record(ProcessedRecord.success(fingerprint, "/f.png", Instant.now()))));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        assertEquals(40, ledger.size());
        assertEquals(40, ProcessedLedger.open(file, false).size());
    }
}
