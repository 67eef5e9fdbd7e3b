package com.example.imageguard;

import java.nio.file.Path;

/**
 * A user-selected folder. Disabled folders are neither watched nor scanned.
 */
public record MonitoredFolder(
        Path path,
        boolean enabled
) {
    public MonitoredFolder {
        path = path.toAbsolutePath().normalize();
    }

    public static MonitoredFolder enabled(Path path) {
        return new MonitoredFolder(path, true);
    }
}
