package com.example.imageguard;

import com.example.imageguard.capability.DetectionParameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes pre-sanitization backups and quarantines failed files.
 * <p>
 * Both areas use the layout {@code <root>/<yyyyMMddHHmm>/<monitored folder name>/<relative path>}.
 * Destinations are claimed with a non-replacing copy, so concurrent workers never overwrite each other;
 * on a clash the file name gets a {@code _001}, {@code _002}, ... suffix. Nothing here ever deletes a backup.
 */
public final class BackupManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackupManager.class);
    private static final DateTimeFormatter BUCKET = DateTimeFormatter.ofPattern("yyyyMMddHHmm");
    private static final String UNKNOWN_SOURCE = "unknown_source";
    private static final int MAX_SUFFIX = 999;

    private final Path backupRoot;
    private final Path quarantineRoot;
    private final List<MonitoredFolder> folders;
    private final boolean moveFailedToQuarantine;
    private final Clock clock;
    private final ObjectMapper mapper;

    public BackupManager(Path backupRoot,
                         Path quarantineRoot,
                         List<MonitoredFolder> folders,
                         boolean moveFailedToQuarantine,
                         Clock clock) {
        this.backupRoot = backupRoot.toAbsolutePath().normalize();
        this.quarantineRoot = quarantineRoot.toAbsolutePath().normalize();
        this.folders = List.copyOf(folders);
        this.moveFailedToQuarantine = moveFailedToQuarantine;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Copies the file into the backup area. The original is only read.
     */
    public BackupRecord backup(Path file) throws IOException {
        Path original = file.toAbsolutePath().normalize();
        Instant now = clock.instant();
        Path backupPath = claimUniqueDestination(destinationFor(backupRoot, original, now),
                candidate -> Files.copy(original, candidate, StandardCopyOption.COPY_ATTRIBUTES));
        LOGGER.debug("Backed up {} to {}", original, backupPath);
        return new BackupRecord(original, backupPath, now);
    }

    /**
     * Writes {@code content}, the bytes about to be cleaned, into the backup area for {@code file}, so the
     * backup is exactly the input of the cleaning run.
     */
    public BackupRecord backup(Path file, byte[] content) throws IOException {
        Path original = file.toAbsolutePath().normalize();
        Instant now = clock.instant();
        Path backupPath = claimUniqueDestination(destinationFor(backupRoot, original, now),
                candidate -> Files.write(candidate, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
        try {
            Files.setLastModifiedTime(backupPath, Files.getLastModifiedTime(original));
        } catch (IOException ex) {
            LOGGER.debug("Could not carry modification time of {} to its backup", original, ex);
        }
        LOGGER.debug("Backed up {} ({} bytes) to {}", original, content.length, backupPath);
        return new BackupRecord(original, backupPath, now);
    }

    /**
     * Preserves a failed file and writes its error report. When the original has vanished the backup copy
     * (if any) is quarantined instead. The original is only removed in move mode, only when a backup of it
     * exists and only after the quarantine copy exists; a failed backup never costs the user the original.
     */
    public QuarantineEntry quarantine(FileTask task,
                                      BackupRecord backup,
                                      FailureReason reason,
                                      String detail,
                                      DetectionParameters detection) throws IOException {
        Path original = task.path();
        Path source = original;
        if (!Files.isRegularFile(original)) {
            if (backup == null || !Files.isRegularFile(backup.backupPath())) {
                throw new IOException("Nothing to quarantine for " + original + ": file vanished and no backup exists");
            }
            source = backup.backupPath();
        }
        Instant now = clock.instant();
        Path copySource = source;
        Path quarantined = claimUniqueDestination(destinationFor(quarantineRoot, original, now),
                candidate -> Files.copy(copySource, candidate, StandardCopyOption.COPY_ATTRIBUTES));
        Path reportPath = quarantined.resolveSibling(quarantined.getFileName() + "_error.json");
        QuarantineEntry.Report report = new QuarantineEntry.Report(
                original.toString(),
                quarantined.toString(),
                task.source(),
                reason,
                detail,
                task.fingerprint(),
                now,
                detection
        );
        mapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);

        if (moveFailedToQuarantine && source.equals(original)) {
            if (!hasBackup(backup, reason)) {
                LOGGER.warn("No backup of {}; leaving the failed original in place", original);
            } else if (Files.size(quarantined) == Files.size(original)) {
                Files.deleteIfExists(original);
                LOGGER.info("Moved failed file {} to quarantine {}", original, quarantined);
            } else {
                LOGGER.warn("Quarantine copy {} differs in size from {}; original left in place", quarantined, original);
            }
        }
        return new QuarantineEntry(original, quarantined, reportPath, reason, detail, now);
    }

    private static boolean hasBackup(BackupRecord backup, FailureReason reason) {
        return reason != FailureReason.BACKUP_ERROR && backup != null && Files.isRegularFile(backup.backupPath());
    }

    public Path backupRoot() {
        return backupRoot;
    }

    public Path quarantineRoot() {
        return quarantineRoot;
    }

    Path destinationFor(Path root, Path original, Instant when) {
        Path bucket = root.resolve(BUCKET.format(when.atZone(ZoneId.systemDefault())));
        for (MonitoredFolder folder : folders) {
            Path base = folder.path();
            if (original.startsWith(base) && !original.equals(base)) {
                Path name = base.getFileName();
                return bucket.resolve(name == null ? UNKNOWN_SOURCE : name.toString()).resolve(base.relativize(original));
            }
        }
        return bucket.resolve(UNKNOWN_SOURCE).resolve(original.getFileName());
    }

    private Path claimUniqueDestination(Path preferred, DestinationWriter writer) throws IOException {
        Files.createDirectories(preferred.getParent());
        String fileName = preferred.getFileName().toString();
        String stem = stem(fileName);
        String extension = fileName.substring(stem.length());
        Path candidate = preferred;
        for (int counter = 1; ; counter++) {
            try {
                writer.write(candidate);
                return candidate;
            } catch (FileAlreadyExistsException ex) {
                if (counter > MAX_SUFFIX) {
                    throw new IOException("No free destination name for " + preferred, ex);
                }
                candidate = preferred.resolveSibling(String.format("%s_%03d%s", stem, counter, extension));
            }
        }
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    // Must fail with FileAlreadyExistsException when the candidate is taken.
    @FunctionalInterface
    private interface DestinationWriter {
        void write(Path candidate) throws IOException;
    }
}
