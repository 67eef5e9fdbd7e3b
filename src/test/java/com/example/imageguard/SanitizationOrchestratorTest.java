package com.example.imageguard;

import com.example.imageguard.capability.DetectionParameters;
import com.example.imageguard.capability.HsvPixelCleaner;
import com.example.imageguard.capability.ImageFormat;
import com.example.imageguard.capability.ImageIoMetadataStripper;
import com.example.imageguard.capability.MetadataStripper;
import com.example.imageguard.capability.PixelCleaner;
import org.apache.tika.Tika;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SanitizationOrchestratorTest {
    private final FileFingerprinter fingerprinter = new FileFingerprinter();
    private Path root;
    private Path photos;
    private ProcessedLedger ledger;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("orchestrator");
        photos = Files.createDirectories(root.resolve("photos"));
        ledger = ProcessedLedger.open(root.resolve("ledger.json"), false);
    }

    @Test
    void cleansDotAndCommitsAtomically() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        byte[] originalBytes = Files.readAllBytes(image);
        String originalFingerprint = fingerprinter.fingerprint(originalBytes);

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertTrue(result.isSuccess());
        assertEquals(TaskState.COMMITTED, result.state());
        assertTrue(result.metadataPhase().isApplied());
        assertTrue(result.pixelPhase().isApplied());
        assertEquals(0, TestImages.countDotPixels(ImageIO.read(image.toFile())));
        assertArrayEquals(originalBytes, Files.readAllBytes(result.backup().backupPath()));
        assertEquals(ProcessedRecord.Outcome.SUCCESS, ledger.lookup(originalFingerprint).orElseThrow().outcome());
        assertEquals(result.cleanedFingerprint(), fingerprinter.fingerprint(image));
        assertTrue(ledger.isTerminal(result.cleanedFingerprint()));
        try (Stream<Path> files = Files.list(photos)) {
            assertEquals(List.of(image), files.toList());
        }
    }

    @Test
    void backupFailureLeavesOriginalUntouched() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        byte[] originalBytes = Files.readAllBytes(image);
        Path blockedBackup = Files.writeString(root.resolve("backup"), "a file where a directory belongs");

        SanitizationResult result = orchestrator(blockedBackup, new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.BACKUP_ERROR, result.failureReason());
        assertEquals(TaskState.PENDING, result.reachedState());
        assertNull(result.metadataPhase());
        assertArrayEquals(originalBytes, Files.readAllBytes(image));
        ProcessedRecord record = ledger.lookup(fingerprinter.fingerprint(originalBytes)).orElseThrow();
        assertEquals(FailureReason.BACKUP_ERROR, record.reason());
    }

    @Test
    void backupFailureInMoveModeKeepsOriginal() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        byte[] originalBytes = Files.readAllBytes(image);
        Path blockedBackup = Files.writeString(root.resolve("backup"), "a file where a directory belongs");

        SanitizationResult result = orchestrator(blockedBackup, true, new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertEquals(FailureReason.BACKUP_ERROR, result.failureReason());
        assertTrue(Files.exists(image));
        assertArrayEquals(originalBytes, Files.readAllBytes(image));
    }

    @Test
    void rewriteAfterAdmissionRecordsOnlyTheContentActuallyCleaned() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        String admittedFingerprint = fingerprinter.fingerprint(image);
        byte[] rewritten = TestImages.encode(TestImages.grayWithDot(64, 5, 30, 14), "png");
        Files.write(image, rewritten);

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromScan(image, admittedFingerprint));

        assertTrue(result.isSuccess());
        String rewrittenFingerprint = fingerprinter.fingerprint(rewritten);
        assertEquals(rewrittenFingerprint, result.task().fingerprint());
        assertFalse(ledger.lookup(admittedFingerprint).isPresent());
        assertTrue(ledger.isTerminal(rewrittenFingerprint));
        assertArrayEquals(rewritten, Files.readAllBytes(result.backup().backupPath()));
    }

    @Test
    void corruptImageIsQuarantinedAndRecordedAsFailed() throws Exception {
        byte[] valid = TestImages.encode(TestImages.grayWithDot(32, 0, 0, 0), "png");
        Path image = Files.write(photos.resolve("broken.png"), Arrays.copyOf(valid, 40));
        String fingerprint = fingerprinter.fingerprint(image);

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromScan(image, fingerprint));

        assertEquals(FailureReason.DECODE_ERROR, result.failureReason());
        assertEquals(TaskState.BACKED_UP, result.reachedState());
        assertTrue(Files.exists(image));
        assertNotNull(result.quarantine());
        assertTrue(Files.exists(result.quarantine().quarantinedPath()));
        assertTrue(Files.exists(result.quarantine().reportPath()));
        ProcessedRecord record = ledger.lookup(fingerprint).orElseThrow();
        assertTrue(record.isFailed());
        assertEquals(FailureReason.DECODE_ERROR, record.reason());
    }

    @Test
    void unsupportedPixelFormatSkipsPixelPhase() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        PixelCleaner noPixels = new PixelCleaner() {
            @Override
            public boolean supports(ImageFormat format) {
                return false;
            }

            @Override
            public byte[] cleanPixels(byte[] image, ImageFormat format, DetectionParameters parameters) {
                throw new AssertionError("must not be called");
            }
        };

        SanitizationResult result = orchestrator(root.resolve("backup"), noPixels,
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertTrue(result.isSuccess());
        assertEquals(PhaseResult.Kind.SKIPPED, result.pixelPhase().kind());
        assertTrue(TestImages.countDotPixels(ImageIO.read(image.toFile())) > 0);
    }

    @Test
    void disabledDetectionSkipsPixelPhase() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults().disabled())
                .process(FileTask.fromEvent(image));

        assertTrue(result.isSuccess());
        assertEquals(PhaseResult.Kind.SKIPPED, result.pixelPhase().kind());
    }

    @Test
    void crashingCapabilityBecomesCapabilityError() throws Exception {
        Path image = TestImages.writePng(photos.resolve("dot.png"), 12);
        byte[] originalBytes = Files.readAllBytes(image);
        MetadataStripper crashing = (bytes, format) -> {
            throw new IllegalStateException("boom");
        };

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(), crashing,
                DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertEquals(FailureReason.CAPABILITY_ERROR, result.failureReason());
        assertTrue(result.metadataPhase().isFailed());
        assertArrayEquals(originalBytes, Files.readAllBytes(image));
        assertTrue(ledger.lookup(fingerprinter.fingerprint(originalBytes)).orElseThrow().isFailed());
    }

    @Test
    void cleanedOutputDecodesAsSameFormat() throws Exception {
        Path image = TestImages.writePng(photos.resolve("plain.png"), 0);

        SanitizationResult result = orchestrator(root.resolve("backup"), new HsvPixelCleaner(),
                new ImageIoMetadataStripper(), DetectionParameters.defaults())
                .process(FileTask.fromEvent(image));

        assertTrue(result.isSuccess());
        byte[] cleaned = Files.readAllBytes(image);
        assertEquals(ImageFormat.PNG, new ImageFormatDetector(new Tika()).detect(cleaned, image).orElseThrow());
        assertNotNull(ImageIO.read(new ByteArrayInputStream(cleaned)));
    }

    private SanitizationOrchestrator orchestrator(Path backupRoot,
                                                  PixelCleaner pixelCleaner,
                                                  MetadataStripper stripper,
                                                  DetectionParameters detection) {
        return orchestrator(backupRoot, false, pixelCleaner, stripper, detection);
    }

    private SanitizationOrchestrator orchestrator(Path backupRoot,
                                                  boolean moveFailedToQuarantine,
                                                  PixelCleaner pixelCleaner,
                                                  MetadataStripper stripper,
                                                  DetectionParameters detection) {
        BackupManager backupManager = new BackupManager(backupRoot, root.resolve("quarantine"),
                List.of(MonitoredFolder.enabled(photos)), moveFailedToQuarantine, Clock.systemDefaultZone());
        return new SanitizationOrchestrator(backupManager, ledger, fingerprinter, new ImageFormatDetector(new Tika()),
                stripper, pixelCleaner, () -> detection, Clock.systemDefaultZone());
    }
}
