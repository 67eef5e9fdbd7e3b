package com.example.imageguard;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DebouncerTest {

    @Test
    void burstForOnePathFiresOnce() throws Exception {
        List<Path> fired = new CopyOnWriteArrayList<>();
        Path file = Path.of("burst.png").toAbsolutePath();
        try (Debouncer debouncer = new Debouncer(Duration.ofMillis(200), fired::add)) {
            for (int i = 0; i < 5; i++) {
                debouncer.touch(file);
                Thread.sleep(40);
            }
            assertTrue(TestImages.waitFor(() -> !fired.isEmpty(), Duration.ofSeconds(5)));
            Thread.sleep(400);
            assertEquals(0, debouncer.pendingCount());
        }
        assertEquals(List.of(file), fired);
    }

    @Test
    void distinctPathsFireIndependently() throws Exception {
        List<Path> fired = new CopyOnWriteArrayList<>();
        try (Debouncer debouncer = new Debouncer(Duration.ofMillis(100), fired::add)) {
            debouncer.touch(Path.of("one.png"));
            debouncer.touch(Path.of("two.png"));
            assertTrue(TestImages.waitFor(() -> fired.size() == 2, Duration.ofSeconds(5)));
        }
    }

    @Test
    void touchAfterCloseIsIgnored() {
        List<Path> fired = new CopyOnWriteArrayList<>();
        Debouncer debouncer = new Debouncer(Duration.ofMillis(10), fired::add);
        debouncer.close();

        debouncer.touch(Path.of("late.png"));

        assertEquals(0, debouncer.pendingCount());
    }
}
