package com.example.imageguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Collapses bursts of events for the same path into one callback fired once the path has been quiet for
 * the coalescing window. Every new event for a pending path restarts its timer.
 */
public final class Debouncer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Debouncer.class);

    private final ScheduledExecutorService scheduler;
    private final Duration window;
    private final Consumer<Path> sink;
    private final ConcurrentHashMap<Path, Pending> pending = new ConcurrentHashMap<>();

    public Debouncer(Duration window, Consumer<Path> sink) {
        this.window = window;
        this.sink = sink;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "event-debouncer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void touch(Path path) {
        Path key = path.toAbsolutePath().normalize();
        try {
            pending.compute(key, (ignored, existing) -> {
                if (existing != null) {
                    existing.future().cancel(false);
                }
                Object token = new Object();
                ScheduledFuture<?> future = scheduler.schedule(() -> fire(key, token), window.toMillis(), TimeUnit.MILLISECONDS);
                return new Pending(token, future);
            });
        } catch (RejectedExecutionException ex) {
            LOGGER.debug("Debouncer closed; dropping event for {}", key);
        }
    }

    private void fire(Path path, Object token) {
        boolean[] current = new boolean[1];
        pending.computeIfPresent(path, (ignored, entry) -> {
            if (entry.token() == token) {
                current[0] = true;
                return null;
            }
            return entry;
        });
        if (!current[0]) {
            return;
        }
        try {
            sink.accept(path);
        } catch (RuntimeException ex) {
            LOGGER.error("Handling debounced event for {} failed", path, ex);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        pending.clear();
    }

    private record Pending(Object token, ScheduledFuture<?> future) {
    }
}
