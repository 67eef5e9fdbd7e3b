package com.example.imageguard.capability;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Image formats the guard accepts from watched folders.
 */
public enum ImageFormat {
    JPEG("jpeg", false, List.of("image/jpeg", "image/pjpeg"), "jpg", "jpeg"),
    PNG("png", true, List.of("image/png"), "png"),
    BMP("bmp", false, List.of("image/bmp", "image/x-bmp", "image/x-ms-bmp"), "bmp"),
    TIFF("tiff", true, List.of("image/tiff"), "tiff", "tif"),
    WEBP("webp", true, List.of("image/webp"), "webp"),
    HEIF("heif", false, List.of("image/heif", "image/heic", "image/heif-sequence", "image/heic-sequence"), "heif", "heic");

    private final String imageIoName;
    private final boolean alphaSupported;
    private final List<String> mimeTypes;
    private final Set<String> extensions;

    ImageFormat(String imageIoName, boolean alphaSupported, List<String> mimeTypes, String... extensions) {
        this.imageIoName = imageIoName;
        this.alphaSupported = alphaSupported;
        this.mimeTypes = mimeTypes;
        this.extensions = Set.of(extensions);
    }

    /**
     * Format name understood by {@code javax.imageio} reader/writer lookup.
     */
    public String imageIoName() {
        return imageIoName;
    }

    public boolean alphaSupported() {
        return alphaSupported;
    }

    public Set<String> extensions() {
        return extensions;
    }

    /**
     * Resolves a format from the file name extension, case-insensitively.
     */
    public static Optional<ImageFormat> fromPath(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static Optional<ImageFormat> fromMimeType(String mimeType) {
        if (mimeType == null) {
            return Optional.empty();
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.mimeTypes.contains(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
