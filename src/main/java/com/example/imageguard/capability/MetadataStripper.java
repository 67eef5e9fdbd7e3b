package com.example.imageguard.capability;

/**
 * Removes embedded metadata (EXIF, GPS, XMP, ICC comments, authoring tool tags) from encoded image bytes.
 * Implementations must be pure: the input array is never modified.
 */
@FunctionalInterface
public interface MetadataStripper {
    byte[] stripMetadata(byte[] image, ImageFormat format) throws CapabilityException;
}
