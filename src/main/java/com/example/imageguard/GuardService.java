package com.example.imageguard;

import com.example.imageguard.capability.ImageCodec;
import com.example.imageguard.capability.ImageFormat;
import com.example.imageguard.capability.MetadataStripper;
import com.example.imageguard.capability.PixelCleaner;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the front door (watchers, scans) to the task queue and owns the lifecycle of every thread.
 * <p>
 * Start runs an optional initial scan, registers one watcher per enabled folder and arms the periodic
 * scan timer. Scans run one at a time on a dedicated thread; a scan requested while another is running
 * gets the running scan's handle.
 */
public final class GuardService implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(GuardService.class);
    static final int MAX_STABILITY_CHECKS = 10;

    private final GuardConfig config;
    private final PipelineListener listener;
    private final ProcessedLedger ledger;
    private final ProcessingStats stats = new ProcessingStats();
    private final FileFingerprinter fingerprinter = new FileFingerprinter();
    private final CandidateFilter filter;
    private final TaskQueue taskQueue;
    private final FolderScanner scanner;
    private final Debouncer debouncer;
    private final WriteStabilityTracker writeStability = new WriteStabilityTracker(MAX_STABILITY_CHECKS);
    private final ScheduledExecutorService scanExecutor;
    private final List<FolderWatcher> watchers = new CopyOnWriteArrayList<>();
    private ScanHandle currentScan;
    private boolean started;
    private volatile boolean running;

    public GuardService(GuardConfig config,
                        MetadataStripper metadataStripper,
                        PixelCleaner pixelCleaner,
                        PipelineListener listener) {
        this.config = config;
        this.listener = listener == null ? PipelineListener.noop() : listener;
        this.ledger = ProcessedLedger.open(config.ledgerFile(), config.retryFailed());
        this.filter = CandidateFilter.from(config);
        BackupManager backupManager = new BackupManager(
                config.backupFolder(),
                config.quarantineFolder(),
                config.folders(),
                config.moveFailedToQuarantine(),
                Clock.systemDefaultZone()
        );
        SanitizationOrchestrator orchestrator = new SanitizationOrchestrator(
                backupManager,
                ledger,
                fingerprinter,
                new ImageFormatDetector(new Tika()),
                metadataStripper,
                pixelCleaner,
                config::detection,
                Clock.systemDefaultZone()
        );
        this.taskQueue = new TaskQueue(config.workerCount(), fingerprinter, ledger, orchestrator, stats, this.listener);
        this.scanner = new FolderScanner(filter, fingerprinter, ledger, taskQueue, config.followLinks());
        this.debouncer = new Debouncer(config.debounceWindow(), this::onQuietPath);
        this.scanExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "folder-scan");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("GuardService can only be started once");
        }
        started = true;
        running = true;
        for (ImageFormat format : formatsWithoutCodec()) {
            LOGGER.warn("No ImageIO codec for {} on this runtime; {} files will be quarantined as unsupported",
                    format, format.extensions());
        }
        List<MonitoredFolder> folders = config.enabledFolders();
        if (config.initialScan()) {
            triggerScan();
        }
        for (MonitoredFolder folder : folders) {
            if (!Files.isDirectory(folder.path())) {
                LOGGER.warn("Monitored folder {} does not exist; not watching it", folder.path());
                continue;
            }
            FolderWatcher watcher = new FolderWatcher(folder, filter, debouncer, this::triggerScan);
            watcher.start();
            watchers.add(watcher);
        }
        Duration interval = config.scanInterval();
        if (!interval.isZero() && !interval.isNegative()) {
            scanExecutor.scheduleWithFixedDelay(this::periodicScan, interval.toMillis(), interval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }
        LOGGER.info("Guard started: {} folders watched, {} workers, ledger {} ({} records)",
                watchers.size(), config.workerCount(), ledger.path(), ledger.size());
    }

    static List<ImageFormat> formatsWithoutCodec() {
        return Arrays.stream(ImageFormat.values())
                .filter(format -> !ImageCodec.canReadAndWrite(format))
                .toList();
    }

    /**
     * Starts a full scan of all enabled folders, or returns the scan already in progress.
     */
    public synchronized ScanHandle triggerScan() {
        if (currentScan != null && !currentScan.isDone()) {
            return currentScan;
        }
        ScanHandle handle = new ScanHandle();
        currentScan = handle;
        if (!running) {
            handle.complete(new ScanSummary(0, 0, 0, 0, 0, true));
            return handle;
        }
        try {
            scanExecutor.execute(() -> runScan(handle));
        } catch (RejectedExecutionException ex) {
            handle.complete(new ScanSummary(0, 0, 0, 0, 0, true));
        }
        return handle;
    }

    public synchronized void cancelScan() {
        if (currentScan != null) {
            currentScan.cancel();
        }
    }

    private void periodicScan() {
        ScanHandle handle;
        synchronized (this) {
            if (currentScan != null && !currentScan.isDone()) {
                LOGGER.debug("Skipping periodic scan; a scan is already running");
                return;
            }
            handle = new ScanHandle();
            currentScan = handle;
        }
        runScan(handle);
    }

    private void runScan(ScanHandle handle) {
        try {
            ScanSummary summary = scanner.scan(config.enabledFolders(), handle);
            handle.complete(summary);
            try {
                listener.scanFinished(summary);
            } catch (RuntimeException ex) {
                LOGGER.warn("Pipeline listener failed", ex);
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Scan failed", ex);
            handle.completeExceptionally(ex);
        }
    }

    private void onQuietPath(Path path) {
        if (!running || !Files.isRegularFile(path)) {
            return;
        }
        switch (writeStability.check(path)) {
            case READY -> taskQueue.submit(FileTask.fromEvent(path));
            case WAIT -> debouncer.touch(path);
            case ABANDON -> LOGGER.warn("{} is still changing or unreadable; leaving it for the next event or scan", path);
        }
    }

    public GuardStatus status() {
        List<Path> folders = config.enabledFolders().stream().map(MonitoredFolder::path).toList();
        long activeWatchers = watchers.stream().filter(FolderWatcher::isAlive).count();
        return new GuardStatus(running, folders, (int) activeWatchers, taskQueue.inFlightCount(), stats());
    }

    public StatsSnapshot stats() {
        return stats.snapshot(config.enabledFolders().size());
    }

    public ProcessedLedger ledger() {
        return ledger;
    }

    /**
     * Forgets every failed outcome so those files are picked up again by the next event or scan.
     */
    public int clearFailed() {
        int removed = ledger.clearFailed();
        LOGGER.info("Cleared {} failed ledger records", removed);
        return removed;
    }

    public TaskQueue taskQueue() {
        return taskQueue;
    }

    /**
     * Stops watching and scanning, then waits for admitted tasks to reach a terminal state.
     */
    public void stop() throws InterruptedException {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            if (currentScan != null) {
                currentScan.cancel();
            }
        }
        for (FolderWatcher watcher : watchers) {
            try {
                watcher.close();
            } catch (IOException ex) {
                LOGGER.warn("Failed to close watcher for {}", watcher.folder().path(), ex);
            }
        }
        watchers.clear();
        debouncer.close();
        scanExecutor.shutdown();
        if (!scanExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            scanExecutor.shutdownNow();
        }
        taskQueue.close();
        LOGGER.info("Guard stopped: {}", stats());
    }

    @Override
    public void close() throws InterruptedException {
        stop();
    }
}
