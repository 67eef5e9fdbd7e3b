package com.example.imageguard;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation and completion for one running scan. Cancelling stops the walk; tasks that
 * were already admitted still run.
 */
public final class ScanHandle {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<ScanSummary> completion = new CompletableFuture<>();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public ScanSummary awaitCompletion(Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void complete(ScanSummary summary) {
        completion.complete(summary);
    }

    void completeExceptionally(Throwable error) {
        completion.completeExceptionally(error);
    }
}
