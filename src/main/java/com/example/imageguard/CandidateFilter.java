package com.example.imageguard;

import com.example.imageguard.capability.ImageFormat;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which paths the watcher and the scanner may hand to the task queue. Applied before any
 * fingerprinting.
 */
public final class CandidateFilter {
    private final List<Path> ignoredRoots;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirectories;

    public CandidateFilter(List<Path> ignoredRoots, List<String> excludeFilePatterns, List<String> excludeDirectoryPatterns) {
        this.ignoredRoots = ignoredRoots.stream().map(path -> path.toAbsolutePath().normalize()).toList();
        this.excludedFiles = compile(excludeFilePatterns);
        this.excludedDirectories = compile(excludeDirectoryPatterns);
    }

    public static CandidateFilter from(GuardConfig config) {
        return new CandidateFilter(
                List.of(config.backupFolder(), config.quarantineFolder()),
                config.excludeFilePatterns(),
                config.excludeDirectoryPatterns()
        );
    }

    /**
     * Accepts supported image extensions outside the backup and quarantine areas, skipping our own temp
     * files, editor lock files and excluded names.
     */
    public boolean acceptsFile(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        if (fileName.startsWith("~") || fileName.endsWith(SanitizationOrchestrator.TEMP_SUFFIX)) {
            return false;
        }
        if (ImageFormat.fromPath(path).isEmpty()) {
            return false;
        }
        if (matchesAny(excludedFiles, name) || isIgnored(path)) {
            return false;
        }
        return true;
    }

    public boolean acceptsDirectory(Path path) {
        Path name = path.getFileName();
        if (name != null && matchesAny(excludedDirectories, name)) {
            return false;
        }
        return !isIgnored(path);
    }

    private boolean isIgnored(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        for (Path root : ignoredRoots) {
            if (normalized.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path name) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        return List.copyOf(matchers);
    }
}
