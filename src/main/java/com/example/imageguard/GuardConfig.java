package com.example.imageguard;

import com.example.imageguard.capability.DetectionParameters;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Immutable runtime settings for the guard.
 *
 * @param scanInterval periodic full scan interval; {@link Duration#ZERO} disables the timer
 */
public record GuardConfig(
        List<MonitoredFolder> folders,
        Path backupFolder,
        Path quarantineFolder,
        Path ledgerFile,
        int workerCount,
        Duration scanInterval,
        boolean initialScan,
        Duration debounceWindow,
        boolean followLinks,
        boolean retryFailed,
        boolean moveFailedToQuarantine,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        DetectionParameters detection
) {
    /**
     * Settings with every optional value at its default, for the given folders and backup area.
     */
    public static GuardConfig defaults(List<MonitoredFolder> folders, Path backupFolder) {
        return new GuardConfig(
                List.copyOf(folders),
                backupFolder,
                backupFolder.resolve(ConfigLoader.DEFAULT_QUARANTINE_DIRECTORY),
                backupFolder.resolve(ConfigLoader.DEFAULT_LEDGER_FILE),
                ConfigLoader.DEFAULT_WORKER_COUNT,
                Duration.ZERO,
                true,
                Duration.ofMillis(ConfigLoader.DEFAULT_DEBOUNCE_MILLIS),
                false,
                false,
                false,
                ConfigLoader.DEFAULT_EXCLUDE_FILES,
                ConfigLoader.DEFAULT_EXCLUDE_DIRECTORIES,
                DetectionParameters.defaults()
        );
    }

    public List<MonitoredFolder> enabledFolders() {
        return folders.stream().filter(MonitoredFolder::enabled).toList();
    }
}
