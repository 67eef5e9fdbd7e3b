package com.example.imageguard.capability;

import java.awt.image.BufferedImage;

/**
 * Strips metadata by decoding to pixels and re-encoding a fresh image in the same format.
 */
public final class ImageIoMetadataStripper implements MetadataStripper {

    @Override
    public byte[] stripMetadata(byte[] image, ImageFormat format) throws CapabilityException {
        if (!ImageCodec.canReadAndWrite(format)) {
            throw CapabilityException.unsupported(format, "metadata");
        }
        BufferedImage pixels = ImageCodec.decode(image, format);
        return ImageCodec.encode(pixels, format);
    }
}
