package com.example.imageguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FolderScannerTest {

    @Test
    void enqueuesOnlyUnprocessedSupportedImages() throws Exception {
        Path root = Files.createTempDirectory("scanner");
        Path photos = Files.createDirectories(root.resolve("photos"));
        Path nested = Files.createDirectories(photos.resolve("2024").resolve("june"));
        Files.writeString(photos.resolve("a.png"), "a");
        Files.writeString(nested.resolve("b.JPG"), "b");
        Files.writeString(nested.resolve("c.jpeg"), "already done");
        Files.writeString(photos.resolve("anim.gif"), "gif");
        Files.writeString(photos.resolve("~lock.png"), "lock");
        Files.writeString(photos.resolve("notes.txt"), "text");
        Path backup = Files.createDirectories(photos.resolve("errorbak"));
        Files.writeString(backup.resolve("old.png"), "backup copy");

        ProcessedLedger ledger = ProcessedLedger.open(root.resolve("ledger.json"), false);
        FileFingerprinter fingerprinter = new FileFingerprinter();
        ledger.record(ProcessedRecord.success(fingerprinter.fingerprint(nested.resolve("c.jpeg")), "c", Instant.now()));
        Set<Path> processed = ConcurrentHashMap.newKeySet();
        CandidateFilter filter = new CandidateFilter(List.of(backup), ConfigLoader.DEFAULT_EXCLUDE_FILES,
                ConfigLoader.DEFAULT_EXCLUDE_DIRECTORIES);

        ScanSummary summary;
        try (TaskQueue queue = new TaskQueue(2, fingerprinter, ledger, collecting(ledger, processed),
                new ProcessingStats(), null)) {
            summary = new FolderScanner(filter, fingerprinter, ledger, queue, false)
                    .scan(List.of(MonitoredFolder.enabled(photos)), new ScanHandle());
            assertTrue(queue.awaitIdle(Duration.ofSeconds(10)));
        }

        assertEquals(Set.of(photos.resolve("a.png"), nested.resolve("b.JPG")), processed);
        assertEquals(2, summary.enqueued());
        assertEquals(1, summary.skippedProcessed());
        assertEquals(3, summary.skippedFiltered());
        assertEquals(6, summary.filesSeen());
        assertFalse(summary.cancelled());
    }

    @Test
    void disabledAndMissingFoldersAreSkipped() throws Exception {
        Path root = Files.createTempDirectory("scanner");
        Path disabled = Files.createDirectories(root.resolve("off"));
        Files.writeString(disabled.resolve("a.png"), "a");
        ProcessedLedger ledger = ProcessedLedger.open(root.resolve("ledger.json"), false);
        FileFingerprinter fingerprinter = new FileFingerprinter();

        ScanSummary summary;
        try (TaskQueue queue = new TaskQueue(1, fingerprinter, ledger, collecting(ledger, ConcurrentHashMap.newKeySet()),
                new ProcessingStats(), null)) {
            summary = new FolderScanner(new CandidateFilter(List.of(), List.of(), List.of()), fingerprinter, ledger, queue, false)
                    .scan(List.of(new MonitoredFolder(disabled, false), MonitoredFolder.enabled(root.resolve("missing"))),
                            new ScanHandle());
        }

        assertEquals(0, summary.filesSeen());
    }

    @Test
    void cancelledScanStopsWalking() throws Exception {
        Path root = Files.createTempDirectory("scanner");
        Path photos = Files.createDirectories(root.resolve("photos"));
        for (int i = 0; i < 5; i++) {
            Files.writeString(photos.resolve("img" + i + ".png"), "content " + i);
        }
        ProcessedLedger ledger = ProcessedLedger.open(root.resolve("ledger.json"), false);
        FileFingerprinter fingerprinter = new FileFingerprinter();
        ScanHandle handle = new ScanHandle();
        handle.cancel();

        ScanSummary summary;
        try (TaskQueue queue = new TaskQueue(1, fingerprinter, ledger, collecting(ledger, ConcurrentHashMap.newKeySet()),
                new ProcessingStats(), null)) {
            summary = new FolderScanner(new CandidateFilter(List.of(), List.of(), List.of()), fingerprinter, ledger, queue, false)
                    .scan(List.of(MonitoredFolder.enabled(photos)), handle);
        }

        assertTrue(summary.cancelled());
        assertEquals(0, summary.enqueued());
    }

    private static TaskProcessor collecting(ProcessedLedger ledger, Set<Path> processed) {
        return task -> {
            processed.add(task.path());
            ledger.record(ProcessedRecord.success(task.fingerprint(), task.path().toString(), Instant.now()));
            return SanitizationResult.committed(task, PhaseResult.skipped("test"), PhaseResult.skipped("test"), null,
                    task.fingerprint());
        };
    }
}
