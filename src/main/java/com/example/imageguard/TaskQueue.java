package com.example.imageguard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admission control in front of a fixed worker pool.
 * <p>
 * A task is admitted only when its fingerprint has no terminal ledger outcome and is not already in
 * flight. The in-flight entry is released in a {@code finally} block once the worker is done, whatever the
 * outcome. The backlog queue is unbounded; admission keeps duplicates out of it.
 */
public final class TaskQueue implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskQueue.class);

    public enum Admission {
        ADMITTED,
        ALREADY_PROCESSED,
        IN_FLIGHT,
        UNREADABLE,
        CLOSED
    }

    private final FileFingerprinter fingerprinter;
    private final ProcessedLedger ledger;
    private final TaskProcessor processor;
    private final ProcessingStats stats;
    private final PipelineListener listener;
    private final ExecutorService workers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Object idleMonitor = new Object();
    private int outstanding;
    private volatile boolean closed;

    public TaskQueue(int workerCount,
                     FileFingerprinter fingerprinter,
                     ProcessedLedger ledger,
                     TaskProcessor processor,
                     ProcessingStats stats,
                     PipelineListener listener) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.fingerprinter = fingerprinter;
        this.ledger = ledger;
        this.processor = processor;
        this.stats = stats;
        this.listener = listener == null ? PipelineListener.noop() : listener;
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
    }

    /**
     * Runs admission on the calling thread (hashing the file if the task has no fingerprint yet) and hands
     * admitted tasks to the pool. Never blocks on sanitization work.
     */
    public Admission submit(FileTask task) {
        if (closed) {
            return reject(task, Admission.CLOSED);
        }
        FileTask fingerprinted = task;
        if (task.fingerprint() == null) {
            try {
                fingerprinted = task.withFingerprint(fingerprinter.fingerprint(task.path()));
            } catch (IOException ex) {
                LOGGER.warn("Cannot fingerprint {}: {}", task.path(), ex.toString());
                return reject(task, Admission.UNREADABLE);
            }
        }
        String fingerprint = fingerprinted.fingerprint();
        if (ledger.isTerminal(fingerprint)) {
            return reject(fingerprinted, Admission.ALREADY_PROCESSED);
        }
        if (!inFlight.add(fingerprint)) {
            return reject(fingerprinted, Admission.IN_FLIGHT);
        }
        // A worker may have committed this fingerprint between the ledger check and the add above.
        if (ledger.isTerminal(fingerprint)) {
            inFlight.remove(fingerprint);
            return reject(fingerprinted, Admission.ALREADY_PROCESSED);
        }

        FileTask admitted = fingerprinted;
        synchronized (idleMonitor) {
            outstanding++;
        }
        try {
            workers.execute(() -> runTask(admitted));
        } catch (RejectedExecutionException ex) {
            release(fingerprint);
            return reject(admitted, Admission.CLOSED);
        }
        stats.admitted();
        LOGGER.debug("Admitted {} ({}) from {}", admitted.path(), fingerprint, admitted.source());
        notifyListener(() -> listener.taskAdmitted(admitted));
        return Admission.ADMITTED;
    }

    private void runTask(FileTask task) {
        try {
            SanitizationResult result = processor.process(task);
            stats.completed(result.isSuccess());
            notifyListener(() -> listener.taskCompleted(result));
        } catch (RuntimeException ex) {
            LOGGER.error("Worker crashed while processing {}", task.path(), ex);
            stats.completed(false);
        } finally {
            release(task.fingerprint());
        }
    }

    private void release(String fingerprint) {
        inFlight.remove(fingerprint);
        synchronized (idleMonitor) {
            outstanding--;
            if (outstanding == 0) {
                idleMonitor.notifyAll();
            }
        }
    }

    private Admission reject(FileTask task, Admission admission) {
        stats.rejected();
        LOGGER.debug("Rejected {}: {}", task.path(), admission);
        notifyListener(() -> listener.taskRejected(task, admission));
        return admission;
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Pipeline listener failed", ex);
        }
    }

    public boolean isInFlight(String fingerprint) {
        return inFlight.contains(fingerprint);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits until every admitted task has finished. Returns false on timeout.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (outstanding > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    /**
     * Stops admission and lets already admitted tasks run to a terminal state.
     */
    @Override
    public void close() throws InterruptedException {
        closed = true;
        workers.shutdown();
        if (!workers.awaitTermination(1, TimeUnit.HOURS)) {
            LOGGER.warn("Workers still busy after shutdown timeout");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "sanitize-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
