package com.example.imageguard;

import com.example.imageguard.capability.ImageFormat;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves the real image format from content magic, falling back to the file extension when Tika only
 * reports a generic type.
 */
public class ImageFormatDetector {
    private final Tika tika;

    public ImageFormatDetector(Tika tika) {
        this.tika = tika;
    }

    public Optional<ImageFormat> detect(byte[] content, Path path) {
        Optional<ImageFormat> detected = ImageFormat.fromMimeType(detectMimeType(content, path));
        return detected.isPresent() ? detected : ImageFormat.fromPath(path);
    }

    private String detectMimeType(byte[] content, Path path) {
        Path name = path.getFileName();
        MediaType mediaType = MediaType.parse(tika.detect(content, name == null ? null : name.toString()));
        return mediaType == null ? "application/octet-stream" : mediaType.getBaseType().toString();
    }
}
