package com.example.imageguard;

import com.example.imageguard.capability.CapabilityException;
import com.example.imageguard.capability.DetectionParameters;
import com.example.imageguard.capability.ImageFormat;
import com.example.imageguard.capability.MetadataStripper;
import com.example.imageguard.capability.PixelCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Drives one file through backup, metadata pass, pixel pass and commit.
 * <p>
 * The original is only ever replaced by an atomic rename of a fully written sibling temp file, so readers
 * see either the old or the new bytes. Any failure after the backup leaves the original in place, sends it
 * to quarantine and records the reason in the ledger. A run is never abandoned half way.
 */
public final class SanitizationOrchestrator implements TaskProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(SanitizationOrchestrator.class);
    public static final String TEMP_SUFFIX = ".imageguard-tmp";

    private final BackupManager backupManager;
    private final ProcessedLedger ledger;
    private final FileFingerprinter fingerprinter;
    private final ImageFormatDetector formatDetector;
    private final MetadataStripper metadataStripper;
    private final PixelCleaner pixelCleaner;
    private final Supplier<DetectionParameters> detection;
    private final Clock clock;

    public SanitizationOrchestrator(BackupManager backupManager,
                                    ProcessedLedger ledger,
                                    FileFingerprinter fingerprinter,
                                    ImageFormatDetector formatDetector,
                                    MetadataStripper metadataStripper,
                                    PixelCleaner pixelCleaner,
                                    Supplier<DetectionParameters> detection,
                                    Clock clock) {
        this.backupManager = backupManager;
        this.ledger = ledger;
        this.fingerprinter = fingerprinter;
        this.formatDetector = formatDetector;
        this.metadataStripper = metadataStripper;
        this.pixelCleaner = pixelCleaner;
        this.detection = detection;
        this.clock = clock;
    }

    @Override
    public SanitizationResult process(FileTask task) {
        DetectionParameters parameters = detection.get();
        TaskState state = TaskState.PENDING;
        PhaseResult metadataPhase = null;
        PhaseResult pixelPhase = null;

        byte[] original;
        try {
            original = read(task.path());
        } catch (SanitizationException ex) {
            // the admission fingerprint is unverified without the bytes; record nothing under it
            return fail(task.withFingerprint(null), state, null, null, null, parameters, ex);
        }
        String fingerprint = fingerprinter.fingerprint(original);
        if (task.fingerprint() != null && !fingerprint.equals(task.fingerprint())) {
            LOGGER.info("{} changed after admission; processing its current content", task.path());
        }
        task = task.withFingerprint(fingerprint);

        BackupRecord backup;
        try {
            backup = backupManager.backup(task.path(), original);
        } catch (IOException ex) {
            return fail(task, state, null, null, null, parameters,
                    new SanitizationException(FailureReason.BACKUP_ERROR, "Backup failed: " + describe(ex), ex));
        }
        state = TaskState.BACKED_UP;

        try {
            FileTask current = task;
            ImageFormat format = formatDetector.detect(original, task.path())
                    .orElseThrow(() -> new SanitizationException(FailureReason.UNSUPPORTED_FORMAT,
                            "Unrecognized image format: " + current.path().getFileName()));

            metadataPhase = runMetadataPhase(original, format);
            if (metadataPhase.isFailed()) {
                throw metadataPhase.error();
            }
            state = TaskState.METADATA_CLEANED;

            pixelPhase = runPixelPhase(metadataPhase.bytes(), format, parameters);
            if (pixelPhase.isFailed()) {
                throw pixelPhase.error();
            }
            state = TaskState.PIXEL_CLEANED;

            byte[] cleaned = pixelPhase.isApplied() ? pixelPhase.bytes() : metadataPhase.bytes();
            String cleanedFingerprint = commit(task, cleaned);
            LOGGER.info("Sanitized {} (metadata: {}, pixels: {})", task.path(), metadataPhase, pixelPhase);
            return SanitizationResult.committed(task, metadataPhase, pixelPhase, backup, cleanedFingerprint);
        } catch (SanitizationException ex) {
            return fail(task, state, metadataPhase, pixelPhase, backup, parameters, ex);
        } catch (RuntimeException ex) {
            return fail(task, state, metadataPhase, pixelPhase, backup, parameters,
                    new SanitizationException(FailureReason.CAPABILITY_ERROR, "Unexpected error: " + describe(ex), ex));
        }
    }

    private PhaseResult runMetadataPhase(byte[] original, ImageFormat format) {
        try {
            return PhaseResult.applied(metadataStripper.stripMetadata(original, format));
        } catch (CapabilityException ex) {
            return PhaseResult.failed(toSanitizationException("Metadata pass", ex));
        } catch (RuntimeException ex) {
            return PhaseResult.failed(new SanitizationException(FailureReason.CAPABILITY_ERROR,
                    "Metadata pass crashed: " + describe(ex), ex));
        }
    }

    private PhaseResult runPixelPhase(byte[] input, ImageFormat format, DetectionParameters parameters) {
        if (!parameters.enabled()) {
            return PhaseResult.skipped("pixel pass disabled");
        }
        if (!pixelCleaner.supports(format)) {
            return PhaseResult.skipped("no pixel support for " + format);
        }
        try {
            return PhaseResult.applied(pixelCleaner.cleanPixels(input, format, parameters));
        } catch (CapabilityException ex) {
            if (ex.kind() == CapabilityException.Kind.UNSUPPORTED_FORMAT) {
                return PhaseResult.skipped(ex.getMessage());
            }
            return PhaseResult.failed(toSanitizationException("Pixel pass", ex));
        } catch (RuntimeException ex) {
            return PhaseResult.failed(new SanitizationException(FailureReason.CAPABILITY_ERROR,
                    "Pixel pass crashed: " + describe(ex), ex));
        }
    }

    /**
     * Writes the cleaned bytes next to the original, forces them to disk and renames over the original.
     * The cleaned fingerprint is recorded before the rename so the watcher's echo of this write is rejected.
     */
    private String commit(FileTask task, byte[] cleaned) throws SanitizationException {
        Path target = task.path();
        Path temp = target.resolveSibling("." + target.getFileName() + TEMP_SUFFIX);
        String cleanedFingerprint = fingerprinter.fingerprint(cleaned);
        boolean cleanedRecorded = false;
        try {
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(cleaned);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            ledger.record(ProcessedRecord.success(cleanedFingerprint, target.toString(), clock.instant()));
            cleanedRecorded = true;
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(temp);
            if (cleanedRecorded && !cleanedFingerprint.equals(task.fingerprint())) {
                ledger.clear(cleanedFingerprint);
            }
            throw new SanitizationException(FailureReason.IO_ERROR, "Replacing original failed: " + describe(ex), ex);
        }
        ledger.record(ProcessedRecord.success(task.fingerprint(), target.toString(), clock.instant()));
        return cleanedFingerprint;
    }

    private SanitizationResult fail(FileTask task,
                                    TaskState reached,
                                    PhaseResult metadataPhase,
                                    PhaseResult pixelPhase,
                                    BackupRecord backup,
                                    DetectionParameters parameters,
                                    SanitizationException error) {
        LOGGER.warn("Sanitizing {} failed in state {}: {} {}", task.path(), reached, error.reason(), error.getMessage());
        QuarantineEntry quarantine = null;
        try {
            quarantine = backupManager.quarantine(task, backup, error.reason(), error.getMessage(), parameters);
            LOGGER.info("Quarantined {} as {}", task.path(), quarantine.quarantinedPath());
        } catch (IOException ex) {
            LOGGER.error("Could not quarantine {}", task.path(), ex);
        }
        String fingerprint = task.fingerprint();
        if (fingerprint == null) {
            fingerprint = fingerprintOrNull(task.path());
        }
        if (fingerprint != null) {
            ledger.record(ProcessedRecord.failed(fingerprint, task.path().toString(), error.reason(),
                    error.getMessage(), clock.instant()));
        } else {
            LOGGER.warn("No fingerprint for {}; failure not recorded in ledger", task.path());
        }
        return SanitizationResult.failed(task, reached, metadataPhase, pixelPhase, backup, error.reason(),
                error.getMessage(), quarantine);
    }

    private String fingerprintOrNull(Path path) {
        try {
            return fingerprinter.fingerprint(path);
        } catch (IOException ex) {
            LOGGER.debug("Cannot fingerprint {}", path, ex);
            return null;
        }
    }

    private static byte[] read(Path path) throws SanitizationException {
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new SanitizationException(FailureReason.IO_ERROR, "Cannot read file: " + describe(ex), ex);
        }
    }

    private static SanitizationException toSanitizationException(String phase, CapabilityException ex) {
        FailureReason reason = switch (ex.kind()) {
            case UNSUPPORTED_FORMAT -> FailureReason.UNSUPPORTED_FORMAT;
            case DECODE_ERROR -> FailureReason.DECODE_ERROR;
            case FAILURE -> FailureReason.CAPABILITY_ERROR;
        };
        return new SanitizationException(reason, phase + " failed: " + ex.getMessage(), ex);
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.warn("Could not remove temp file {}", temp, ex);
        }
    }

    private static String describe(Exception ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
