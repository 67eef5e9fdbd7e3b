package com.example.imageguard;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters shared by the front door and the workers.
 */
public final class ProcessingStats {
    private final AtomicLong admitted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public void admitted() {
        admitted.incrementAndGet();
    }

    public void rejected() {
        rejected.incrementAndGet();
    }

    public void completed(boolean success) {
        if (success) {
            succeeded.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }

    public StatsSnapshot snapshot(int folders) {
        return new StatsSnapshot(folders, admitted.get(), rejected.get(), succeeded.get(), failed.get());
    }
}
