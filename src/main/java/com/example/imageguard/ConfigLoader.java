package com.example.imageguard;

import com.example.imageguard.capability.DetectionParameters;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public class ConfigLoader {
    static final int DEFAULT_WORKER_COUNT = 3;
    static final long DEFAULT_DEBOUNCE_MILLIS = 1000;
    static final int DEFAULT_HUE_TOLERANCE = 25;
    static final String DEFAULT_BACKUP_FOLDER = "errorbak";
    static final String DEFAULT_QUARANTINE_DIRECTORY = "quarantine";
    static final String DEFAULT_LEDGER_FILE = "processed-files.json";
    static final List<String> DEFAULT_EXCLUDE_FILES = List.of(
            "Thumbs.db",
            "desktop.ini",
            "ehthumbs.db",
            "*_cleaned.*"
    );
    static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".Trash*"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public GuardConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        List<MonitoredFolder> folders = parseFolders(raw.folders);
        if (folders.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one folder.");
        }

        String backupSetting = raw.backupFolder == null || raw.backupFolder.isBlank()
                ? DEFAULT_BACKUP_FOLDER
                : raw.backupFolder;
        Path backupFolder = Path.of(backupSetting).toAbsolutePath().normalize();
        Path quarantineFolder = raw.quarantineFolder == null || raw.quarantineFolder.isBlank()
                ? backupFolder.resolve(DEFAULT_QUARANTINE_DIRECTORY)
                : Path.of(raw.quarantineFolder).toAbsolutePath().normalize();
        Path ledgerFile = raw.ledgerFile == null || raw.ledgerFile.isBlank()
                ? backupFolder.resolve(DEFAULT_LEDGER_FILE)
                : Path.of(raw.ledgerFile).toAbsolutePath().normalize();
        int workerCount = raw.workerCount != null && raw.workerCount > 0
                ? raw.workerCount
                : DEFAULT_WORKER_COUNT;
        Duration scanInterval = raw.scanIntervalSeconds != null && raw.scanIntervalSeconds > 0
                ? Duration.ofSeconds(raw.scanIntervalSeconds)
                : Duration.ZERO;
        Duration debounce = Duration.ofMillis(raw.debounceMillis != null && raw.debounceMillis >= 0
                ? raw.debounceMillis
                : DEFAULT_DEBOUNCE_MILLIS);

        return new GuardConfig(
                folders,
                backupFolder,
                quarantineFolder,
                ledgerFile,
                workerCount,
                scanInterval,
                raw.initialScan == null || raw.initialScan,
                debounce,
                raw.followLinks != null && raw.followLinks,
                raw.retryFailed != null && raw.retryFailed,
                raw.moveFailedToQuarantine != null && raw.moveFailedToQuarantine,
                mergePatterns(DEFAULT_EXCLUDE_FILES, raw.excludeFilePatterns),
                mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns),
                parseDetection(raw.detection)
        );
    }

    private List<MonitoredFolder> parseFolders(List<JsonNode> nodes) {
        List<MonitoredFolder> folders = new ArrayList<>();
        if (nodes == null) {
            return folders;
        }
        for (JsonNode node : nodes) {
            if (node.isTextual()) {
                folders.add(MonitoredFolder.enabled(Path.of(node.asText())));
            } else if (node.isObject() && node.hasNonNull("path")) {
                boolean enabled = !node.has("enabled") || node.get("enabled").asBoolean(true);
                folders.add(new MonitoredFolder(Path.of(node.get("path").asText()), enabled));
            } else {
                throw new IllegalArgumentException("Folder entries need a path: " + node);
            }
        }
        return List.copyOf(folders);
    }

    private DetectionParameters parseDetection(RawDetection raw) {
        DetectionParameters defaults = DetectionParameters.defaults();
        if (raw == null) {
            return defaults;
        }
        DetectionParameters.RgbColor color = raw.targetColor == null
                ? defaults.targetColor()
                : new DetectionParameters.RgbColor(component(raw.targetColor, 0, "targetColor", 3),
                        component(raw.targetColor, 1, "targetColor", 3),
                        component(raw.targetColor, 2, "targetColor", 3));
        DetectionParameters.Range hue;
        if (raw.hueRange != null) {
            hue = range(raw.hueRange, "hueRange");
        } else if (raw.targetColor != null) {
            int tolerance = raw.hueTolerance != null ? raw.hueTolerance : DEFAULT_HUE_TOLERANCE;
            hue = DetectionParameters.hueWindow(color, tolerance);
        } else {
            hue = defaults.hueRange();
        }
        return new DetectionParameters(
                raw.enabled == null || raw.enabled,
                color,
                hue,
                raw.saturationRange == null ? defaults.saturationRange() : range(raw.saturationRange, "saturationRange"),
                raw.valueRange == null ? defaults.valueRange() : range(raw.valueRange, "valueRange"),
                raw.medianBlurSize == null ? defaults.medianBlurSize() : raw.medianBlurSize,
                raw.morphKernelSize == null ? defaults.morphKernelSize() : raw.morphKernelSize,
                raw.morphIterations == null ? defaults.morphIterations() : raw.morphIterations
        );
    }

    private DetectionParameters.Range range(int[] values, String name) {
        return new DetectionParameters.Range(component(values, 0, name, 2), component(values, 1, name, 2));
    }

    private int component(int[] values, int index, String name, int expectedLength) {
        if (values.length != expectedLength) {
            throw new IllegalArgumentException(name + " must have " + expectedLength + " values.");
        }
        return values[index];
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private static class RawConfig {
        public List<JsonNode> folders = new ArrayList<>();
        public String backupFolder;
        public String quarantineFolder;
        public String ledgerFile;
        public Integer workerCount;
        public Long scanIntervalSeconds;
        public Boolean initialScan;
        public Long debounceMillis;
        public Boolean followLinks;
        public Boolean retryFailed;
        public Boolean moveFailedToQuarantine;
        public List<String> excludeFilePatterns;
        public List<String> excludeDirectoryPatterns;
        public RawDetection detection;
    }

    private static class RawDetection {
        public Boolean enabled;
        public int[] targetColor;
        public int[] hueRange;
        public int[] saturationRange;
        public int[] valueRange;
        public Integer hueTolerance;
        public Integer medianBlurSize;
        public Integer morphKernelSize;
        public Integer morphIterations;
    }
}
