package com.example.imageguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks monitored folders breadth first and feeds unprocessed images to the task queue.
 * <p>
 * Each matching file is fingerprinted during the walk and checked against the ledger, so already
 * processed content never reaches the queue. The cancellation flag is checked before every directory and
 * every file.
 */
public final class FolderScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FolderScanner.class);

    private final CandidateFilter filter;
    private final FileFingerprinter fingerprinter;
    private final ProcessedLedger ledger;
    private final TaskQueue taskQueue;
    private final boolean followLinks;

    public FolderScanner(CandidateFilter filter,
                         FileFingerprinter fingerprinter,
                         ProcessedLedger ledger,
                         TaskQueue taskQueue,
                         boolean followLinks) {
        this.filter = filter;
        this.fingerprinter = fingerprinter;
        this.ledger = ledger;
        this.taskQueue = taskQueue;
        this.followLinks = followLinks;
    }

    public ScanSummary scan(List<MonitoredFolder> folders, ScanHandle handle) {
        Counters counters = new Counters();
        Deque<Path> pending = new ArrayDeque<>();
        for (MonitoredFolder folder : folders) {
            if (!folder.enabled()) {
                continue;
            }
            if (!Files.isDirectory(folder.path())) {
                LOGGER.warn("Monitored folder {} does not exist; skipping scan", folder.path());
                continue;
            }
            pending.addLast(folder.path());
        }

        while (!pending.isEmpty() && !handle.isCancelled()) {
            Path current = pending.removeFirst();
            if (!filter.acceptsDirectory(current)) {
                continue;
            }

            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(current, BasicFileAttributes.class);
            } catch (IOException ex) {
                LOGGER.warn("Failed to read attributes for {}", current, ex);
                continue;
            }
            if (!attrs.isDirectory()) {
                continue;
            }

            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    if (handle.isCancelled()) {
                        break;
                    }
                    if (shouldSkipPath(entry)) {
                        continue;
                    }
                    if (Files.isDirectory(entry, linkOptions())) {
                        pending.addLast(entry);
                    } else if (Files.isRegularFile(entry, linkOptions())) {
                        offer(entry, counters);
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
            }
        }

        ScanSummary summary = counters.toSummary(handle.isCancelled());
        if (summary.cancelled()) {
            LOGGER.info("Scan cancelled after {} files ({} enqueued)", summary.filesSeen(), summary.enqueued());
        } else {
            LOGGER.info("Scan finished: {} files seen, {} enqueued, {} already processed",
                    summary.filesSeen(), summary.enqueued(), summary.skippedProcessed());
        }
        return summary;
    }

    private void offer(Path file, Counters counters) {
        counters.filesSeen++;
        if (!filter.acceptsFile(file)) {
            counters.skippedFiltered++;
            return;
        }
        String fingerprint;
        try {
            fingerprint = fingerprinter.fingerprint(file);
        } catch (IOException ex) {
            LOGGER.warn("Cannot fingerprint {} during scan: {}", file, ex.toString());
            counters.unreadable++;
            return;
        }
        if (ledger.isTerminal(fingerprint)) {
            counters.skippedProcessed++;
            return;
        }
        if (taskQueue.submit(FileTask.fromScan(file, fingerprint)) == TaskQueue.Admission.ADMITTED) {
            counters.enqueued++;
        }
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private boolean shouldSkipPath(Path path) {
        return !followLinks && Files.isSymbolicLink(path);
    }

    private static final class Counters {
        long filesSeen;
        long enqueued;
        long skippedProcessed;
        long skippedFiltered;
        long unreadable;

        ScanSummary toSummary(boolean cancelled) {
            return new ScanSummary(filesSeen, enqueued, skippedProcessed, skippedFiltered, unreadable, cancelled);
        }
    }
}
