package com.example.imageguard.capability;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Thin {@code javax.imageio} wrapper shared by the default capabilities. Encoding always starts from a bare
 * {@link BufferedImage}, so nothing from the source container (EXIF, XMP, text chunks, thumbnails) is carried
 * over.
 */
public final class ImageCodec {
    static final float JPEG_QUALITY = 0.95f;

    private ImageCodec() {
    }

    public static boolean canRead(ImageFormat format) {
        return ImageIO.getImageReadersByFormatName(format.imageIoName()).hasNext();
    }

    public static boolean canWrite(ImageFormat format) {
        return ImageIO.getImageWritersByFormatName(format.imageIoName()).hasNext();
    }

    public static boolean canReadAndWrite(ImageFormat format) {
        return canRead(format) && canWrite(format);
    }

    /**
     * Decodes the first frame into an ARGB or RGB raster.
     */
    public static BufferedImage decode(byte[] image, ImageFormat format) throws CapabilityException {
        if (!canRead(format)) {
            throw CapabilityException.unsupported(format, "decoder");
        }
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(format.imageIoName());
        ImageReader reader = readers.next();
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(image))) {
            if (input == null) {
                throw new CapabilityException(CapabilityException.Kind.FAILURE, "No image input stream available");
            }
            reader.setInput(input, true, true);
            BufferedImage decoded = reader.read(0);
            if (decoded == null) {
                throw new CapabilityException(CapabilityException.Kind.DECODE_ERROR, "Decoder returned no image");
            }
            return toStandardRaster(decoded);
        } catch (IOException | RuntimeException ex) {
            throw new CapabilityException(CapabilityException.Kind.DECODE_ERROR,
                    "Cannot decode " + format + " data: " + ex.getMessage(), ex);
        } finally {
            reader.dispose();
        }
    }

    /**
     * Encodes a raster with default settings for the format. Alpha is flattened onto white for formats that
     * cannot store it.
     */
    public static byte[] encode(BufferedImage image, ImageFormat format) throws CapabilityException {
        if (!canWrite(format)) {
            throw CapabilityException.unsupported(format, "encoder");
        }
        BufferedImage target = image;
        if (image.getColorModel().hasAlpha() && !format.alphaSupported()) {
            target = flatten(image);
        }
        ImageWriter writer = ImageIO.getImageWritersByFormatName(format.imageIoName()).next();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format == ImageFormat.JPEG && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(JPEG_QUALITY);
            }
            writer.write(null, new IIOImage(target, null, null), param);
            output.flush();
        } catch (IOException | RuntimeException ex) {
            throw new CapabilityException(CapabilityException.Kind.FAILURE,
                    "Cannot encode " + format + " image: " + ex.getMessage(), ex);
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    private static BufferedImage toStandardRaster(BufferedImage decoded) {
        int type = decoded.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        if (decoded.getType() == type) {
            return decoded;
        }
        BufferedImage converted = new BufferedImage(decoded.getWidth(), decoded.getHeight(), type);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(decoded, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }

    private static BufferedImage flatten(BufferedImage image) {
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
