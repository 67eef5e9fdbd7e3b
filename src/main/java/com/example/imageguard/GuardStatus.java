package com.example.imageguard;

import java.nio.file.Path;
import java.util.List;

public record GuardStatus(
        boolean running,
        List<Path> monitoredFolders,
        int activeWatchers,
        int inFlight,
        StatsSnapshot stats
) {
}
