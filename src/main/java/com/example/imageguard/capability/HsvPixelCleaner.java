package com.example.imageguard.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Detects tracking marks by HSV thresholding and repaints them from the surrounding pixels.
 * <p>
 * The mask goes through a median blur (drops single-pixel noise), a morphological close then open
 * (fills holes, removes specks), and one final dilation so the rim of each mark is repainted too.
 */
public final class HsvPixelCleaner implements PixelCleaner {
    private static final Logger LOGGER = LoggerFactory.getLogger(HsvPixelCleaner.class);

    @Override
    public boolean supports(ImageFormat format) {
        return ImageCodec.canReadAndWrite(format);
    }

    @Override
    public byte[] cleanPixels(byte[] image, ImageFormat format, DetectionParameters parameters)
            throws CapabilityException {
        if (!supports(format)) {
            throw CapabilityException.unsupported(format, "pixel");
        }
        BufferedImage pixels = ImageCodec.decode(image, format);
        int width = pixels.getWidth();
        int height = pixels.getHeight();
        int[] argb = pixels.getRGB(0, 0, width, height, null, 0, width);

        boolean[] mask = buildMask(argb, parameters);
        if (!anySet(mask)) {
            return image;
        }
        int blur = parameters.medianBlurSize();
        if (blur > 1) {
            mask = medianBlur(mask, width, height, blur % 2 == 0 ? blur + 1 : blur);
        }
        int kernel = Math.max(1, parameters.morphKernelSize());
        for (int i = 0; i < parameters.morphIterations(); i++) {
            mask = dilate(mask, width, height, kernel);
        }
        for (int i = 0; i < parameters.morphIterations(); i++) {
            mask = erode(mask, width, height, kernel);
        }
        for (int i = 0; i < parameters.morphIterations(); i++) {
            mask = erode(mask, width, height, kernel);
        }
        for (int i = 0; i < parameters.morphIterations(); i++) {
            mask = dilate(mask, width, height, kernel);
        }
        if (!anySet(mask)) {
            return image;
        }
        mask = dilate(mask, width, height, Math.max(3, kernel));

        int repainted = repaint(argb, mask, width, height);
        LOGGER.debug("Repainted {} pixels matching hue {}-{}", repainted,
                parameters.hueRange().min(), parameters.hueRange().max());
        pixels.setRGB(0, 0, width, height, argb, 0, width);
        return ImageCodec.encode(pixels, format);
    }

    static boolean[] buildMask(int[] argb, DetectionParameters parameters) {
        boolean[] mask = new boolean[argb.length];
        for (int i = 0; i < argb.length; i++) {
            int pixel = argb[i];
            int[] hsv = DetectionParameters.RgbColor.toHsv((pixel >> 16) & 0xFF, (pixel >> 8) & 0xFF, pixel & 0xFF);
            mask[i] = parameters.matches(hsv[0], hsv[1], hsv[2]);
        }
        return mask;
    }

    /**
     * Binary median: a pixel stays set when more than half of the in-bounds window is set.
     */
    static boolean[] medianBlur(boolean[] mask, int width, int height, int size) {
        int radius = size / 2;
        int[] integral = integral(mask, width, height);
        boolean[] out = new boolean[mask.length];
        for (int y = 0; y < height; y++) {
            int top = Math.max(0, y - radius);
            int bottom = Math.min(height - 1, y + radius);
            for (int x = 0; x < width; x++) {
                int left = Math.max(0, x - radius);
                int right = Math.min(width - 1, x + radius);
                int area = (bottom - top + 1) * (right - left + 1);
                int set = sum(integral, width, left, top, right, bottom);
                out[y * width + x] = set * 2 > area;
            }
        }
        return out;
    }

    static boolean[] dilate(boolean[] mask, int width, int height, int size) {
        return morph(mask, width, height, size, true);
    }

    static boolean[] erode(boolean[] mask, int width, int height, int size) {
        return morph(mask, width, height, size, false);
    }

    // Square kernel; out-of-bounds pixels never influence the result.
    private static boolean[] morph(boolean[] mask, int width, int height, int size, boolean dilate) {
        int before = size / 2;
        int after = size - 1 - before;
        int[] integral = integral(mask, width, height);
        boolean[] out = new boolean[mask.length];
        for (int y = 0; y < height; y++) {
            int top = Math.max(0, y - before);
            int bottom = Math.min(height - 1, y + after);
            for (int x = 0; x < width; x++) {
                int left = Math.max(0, x - before);
                int right = Math.min(width - 1, x + after);
                int set = sum(integral, width, left, top, right, bottom);
                int area = (bottom - top + 1) * (right - left + 1);
                out[y * width + x] = dilate ? set > 0 : set == area;
            }
        }
        return out;
    }

    /**
     * Fills masked pixels ring by ring with the mean of their already-valid 8-neighbours. Alpha is kept.
     */
    static int repaint(int[] argb, boolean[] mask, int width, int height) {
        boolean[] pending = Arrays.copyOf(mask, mask.length);
        int[] queue = new int[mask.length];
        int queued = 0;
        for (int i = 0; i < pending.length; i++) {
            if (pending[i]) {
                queue[queued++] = i;
            }
        }
        int total = queued;
        int[] fills = new int[queued];
        int[] ready = new int[queued];
        while (queued > 0) {
            int readyCount = 0;
            for (int q = 0; q < queued; q++) {
                int index = queue[q];
                int x = index % width;
                int y = index / width;
                long red = 0;
                long green = 0;
                long blue = 0;
                int neighbours = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        int ny = y + dy;
                        if ((dx == 0 && dy == 0) || nx < 0 || ny < 0 || nx >= width || ny >= height) {
                            continue;
                        }
                        int neighbour = ny * width + nx;
                        if (pending[neighbour]) {
                            continue;
                        }
                        int pixel = argb[neighbour];
                        red += (pixel >> 16) & 0xFF;
                        green += (pixel >> 8) & 0xFF;
                        blue += pixel & 0xFF;
                        neighbours++;
                    }
                }
                if (neighbours > 0) {
                    int alpha = argb[index] & 0xFF000000;
                    fills[readyCount] = alpha
                            | ((int) (red / neighbours) << 16)
                            | ((int) (green / neighbours) << 8)
                            | (int) (blue / neighbours);
                    ready[readyCount++] = index;
                }
            }
            if (readyCount == 0) {
                // whole image matched; nothing left to sample from
                break;
            }
            for (int r = 0; r < readyCount; r++) {
                argb[ready[r]] = fills[r];
                pending[ready[r]] = false;
            }
            int remaining = 0;
            for (int q = 0; q < queued; q++) {
                if (pending[queue[q]]) {
                    queue[remaining++] = queue[q];
                }
            }
            queued = remaining;
        }
        return total - queued;
    }

    private static int[] integral(boolean[] mask, int width, int height) {
        int[] integral = new int[(width + 1) * (height + 1)];
        int stride = width + 1;
        for (int y = 0; y < height; y++) {
            int rowSum = 0;
            for (int x = 0; x < width; x++) {
                rowSum += mask[y * width + x] ? 1 : 0;
                integral[(y + 1) * stride + (x + 1)] = integral[y * stride + (x + 1)] + rowSum;
            }
        }
        return integral;
    }

    private static int sum(int[] integral, int width, int left, int top, int right, int bottom) {
        int stride = width + 1;
        return integral[(bottom + 1) * stride + (right + 1)]
                - integral[top * stride + (right + 1)]
                - integral[(bottom + 1) * stride + left]
                + integral[top * stride + left];
    }

    private static boolean anySet(boolean[] mask) {
        for (boolean set : mask) {
            if (set) {
                return true;
            }
        }
        return false;
    }
}
