package com.example.imageguard.capability;

/**
 * Removes colored tracking marks from encoded image bytes.
 */
public interface PixelCleaner {

    /**
     * Returns false when this cleaner has no pixel-phase support for the format. Callers treat that as a
     * pass-through, not as a failure.
     */
    boolean supports(ImageFormat format);

    byte[] cleanPixels(byte[] image, ImageFormat format, DetectionParameters parameters) throws CapabilityException;
}
