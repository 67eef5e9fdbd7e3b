package com.example.imageguard;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a file that went quiet has actually finished being written.
 * <p>
 * A file is ready once it is non-empty, readable and reports the same size on two consecutive checks.
 * Each check is one debounce window apart, so a copy that merely stalls is seen growing again.
 */
public final class WriteStabilityTracker {

    public enum Verdict {
        READY,
        WAIT,
        ABANDON
    }

    private final int maxChecks;
    private final Map<Path, Observation> observations = new ConcurrentHashMap<>();

    public WriteStabilityTracker(int maxChecks) {
        if (maxChecks < 2) {
            throw new IllegalArgumentException("maxChecks must be at least 2");
        }
        this.maxChecks = maxChecks;
    }

    public Verdict check(Path path) {
        Path key = path.toAbsolutePath().normalize();
        long size;
        try {
            size = Files.size(key);
        } catch (IOException ex) {
            observations.remove(key);
            return Verdict.ABANDON;
        }
        Observation previous = observations.get(key);
        if (size > 0 && previous != null && previous.size() == size && Files.isReadable(key)) {
            observations.remove(key);
            return Verdict.READY;
        }
        int checks = previous == null ? 1 : previous.checks() + 1;
        if (checks >= maxChecks) {
            observations.remove(key);
            return Verdict.ABANDON;
        }
        observations.put(key, new Observation(size, checks));
        return Verdict.WAIT;
    }

    public int trackedCount() {
        return observations.size();
    }

    private record Observation(long size, int checks) {
    }
}
