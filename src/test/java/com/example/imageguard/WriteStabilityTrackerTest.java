package com.example.imageguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WriteStabilityTrackerTest {

    @Test
    void growingFileIsNotReadyUntilItsSizeHolds() throws Exception {
        Path file = Files.createTempDirectory("stability").resolve("copying.jpg");
        Files.write(file, new byte[0]);
        WriteStabilityTracker tracker = new WriteStabilityTracker(10);

        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));
        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));

        Files.write(file, new byte[1024], StandardOpenOption.APPEND);
        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));

        // the copy stalls, then resumes
        Files.write(file, new byte[2048], StandardOpenOption.APPEND);
        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));

        assertEquals(WriteStabilityTracker.Verdict.READY, tracker.check(file));
        assertEquals(0, tracker.trackedCount());
    }

    @Test
    void fileThatNeverSettlesIsAbandoned() throws Exception {
        Path file = Files.createTempDirectory("stability").resolve("endless.png");
        Files.write(file, new byte[1]);
        WriteStabilityTracker tracker = new WriteStabilityTracker(3);

        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));
        Files.write(file, new byte[1], StandardOpenOption.APPEND);
        assertEquals(WriteStabilityTracker.Verdict.WAIT, tracker.check(file));
        Files.write(file, new byte[1], StandardOpenOption.APPEND);
        assertEquals(WriteStabilityTracker.Verdict.ABANDON, tracker.check(file));
        assertEquals(0, tracker.trackedCount());
    }

    @Test
    void vanishedFileIsAbandoned() throws Exception {
        Path file = Files.createTempDirectory("stability").resolve("gone.png");

        assertEquals(WriteStabilityTracker.Verdict.ABANDON, new WriteStabilityTracker(5).check(file));
    }
}
