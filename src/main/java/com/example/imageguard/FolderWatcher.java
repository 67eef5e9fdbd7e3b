package com.example.imageguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Recursive create/modify listener for one monitored folder, running on its own thread. It only filters
 * and forwards paths to the debouncer, so it never waits on sanitization work.
 */
public final class FolderWatcher implements Closeable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FolderWatcher.class);

    private final MonitoredFolder folder;
    private final CandidateFilter filter;
    private final Debouncer debouncer;
    private final Runnable overflowHandler;
    private final WatchService watcher;
    private final Map<WatchKey, Path> keyToDir = new ConcurrentHashMap<>();
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private Thread thread;

    /**
     * @param overflowHandler invoked when the OS dropped events; typically schedules a full scan
     */
    public FolderWatcher(MonitoredFolder folder, CandidateFilter filter, Debouncer debouncer, Runnable overflowHandler)
            throws IOException {
        this.folder = folder;
        this.filter = filter;
        this.debouncer = debouncer;
        this.overflowHandler = overflowHandler;
        this.watcher = FileSystems.getDefault().newWatchService();
    }

    public void start() throws IOException {
        registerTree(folder.path());
        thread = new Thread(this::loop, "watch-" + folder.path().getFileName());
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Watching {} ({} directories)", folder.path(), keyToDir.size());
    }

    private void loop() {
        while (alive.get()) {
            WatchKey key;
            try {
                key = watcher.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = keyToDir.get(key);
            if (dir == null) {
                key.reset();
                continue;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                try {
                    handle(dir, event);
                } catch (RuntimeException ex) {
                    LOGGER.error("Failed to handle {} event in {}", event.kind().name(), dir, ex);
                }
            }

            boolean valid = key.reset();
            if (!valid) {
                keyToDir.remove(key);
            }
        }
    }

    private void handle(Path dir, WatchEvent<?> event) {
        WatchEvent.Kind<?> kind = event.kind();
        if (kind == OVERFLOW) {
            LOGGER.warn("Event overflow in {}; requesting a full scan", dir);
            overflowHandler.run();
            return;
        }
        Path full = dir.resolve((Path) event.context());
        if (Files.isDirectory(full, LinkOption.NOFOLLOW_LINKS)) {
            if (kind == ENTRY_CREATE && filter.acceptsDirectory(full)) {
                // a directory moved in brings its files along without per-file events
                try {
                    registerTree(full);
                } catch (IOException ex) {
                    LOGGER.warn("Cannot watch new directory {}", full, ex);
                }
                touchExistingFiles(full);
            }
            return;
        }
        if (filter.acceptsFile(full)) {
            debouncer.touch(full);
        }
    }

    private void touchExistingFiles(Path directory) {
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return filter.acceptsDirectory(dir) ? FileVisitResult.CONTINUE : FileVisitResult.SKIP_SUBTREE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && filter.acceptsFile(file)) {
                        debouncer.touch(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.debug("Skipping unreadable {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            LOGGER.warn("Cannot enumerate new directory {}", directory, ex);
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!filter.acceptsDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                registerDir(dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOGGER.debug("Skipping unreadable {}", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void registerDir(Path dir) throws IOException {
        WatchKey key = dir.register(watcher, ENTRY_CREATE, ENTRY_MODIFY);
        keyToDir.put(key, dir);
    }

    public MonitoredFolder folder() {
        return folder;
    }

    public boolean isAlive() {
        return alive.get() && thread != null && thread.isAlive();
    }

    @Override
    public void close() throws IOException {
        alive.set(false);
        watcher.close();
        keyToDir.clear();
        if (thread != null) {
            try {
                thread.join(2500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
