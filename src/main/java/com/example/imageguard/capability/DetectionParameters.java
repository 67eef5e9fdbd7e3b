package com.example.imageguard.capability;

/**
 * Tracking-mark detection settings. HSV values follow the OpenCV convention: hue 0-179, saturation and
 * value 0-255.
 */
public record DetectionParameters(
        boolean enabled,
        RgbColor targetColor,
        Range hueRange,
        Range saturationRange,
        Range valueRange,
        int medianBlurSize,
        int morphKernelSize,
        int morphIterations
) {
    public static final int MAX_HUE = 179;
    public static final int MAX_CHANNEL = 255;

    public DetectionParameters {
        if (targetColor == null || hueRange == null || saturationRange == null || valueRange == null) {
            throw new IllegalArgumentException("Detection color and ranges are required.");
        }
        if (medianBlurSize < 0 || morphKernelSize < 0 || morphIterations < 0) {
            throw new IllegalArgumentException("Filter sizes and iterations must not be negative.");
        }
    }

    /**
     * Green calibration dots with the stock HSV window [35,40,40]-[85,255,255].
     */
    public static DetectionParameters defaults() {
        return new DetectionParameters(
                true,
                new RgbColor(0, 255, 0),
                new Range(35, 85),
                new Range(40, MAX_CHANNEL),
                new Range(40, MAX_CHANNEL),
                5,
                3,
                2
        );
    }

    /**
     * Builds a window centered on the hue of {@code color}, clamped to the valid hue range.
     */
    public static Range hueWindow(RgbColor color, int tolerance) {
        int hue = color.toHsv()[0];
        return new Range(Math.max(0, hue - tolerance), Math.min(MAX_HUE, hue + tolerance));
    }

    public DetectionParameters disabled() {
        return new DetectionParameters(false, targetColor, hueRange, saturationRange, valueRange,
                medianBlurSize, morphKernelSize, morphIterations);
    }

    public boolean matches(int hue, int saturation, int value) {
        return hueRange.contains(hue) && saturationRange.contains(saturation) && valueRange.contains(value);
    }

    public record Range(int min, int max) {
        public Range {
            if (min > max) {
                throw new IllegalArgumentException("Range minimum " + min + " exceeds maximum " + max);
            }
        }

        public boolean contains(int candidate) {
            return candidate >= min && candidate <= max;
        }
    }

    public record RgbColor(int red, int green, int blue) {
        public RgbColor {
            if (!inChannel(red) || !inChannel(green) || !inChannel(blue)) {
                throw new IllegalArgumentException("RGB channels must be within 0-255.");
            }
        }

        public static RgbColor fromPacked(int rgb) {
            return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
        }

        /**
         * Converts to {hue, saturation, value} using the same integer math as OpenCV's 8-bit BGR2HSV.
         */
        public int[] toHsv() {
            return toHsv(red, green, blue);
        }

        public static int[] toHsv(int red, int green, int blue) {
            int max = Math.max(red, Math.max(green, blue));
            int min = Math.min(red, Math.min(green, blue));
            int delta = max - min;
            int saturation = max == 0 ? 0 : Math.round(delta * 255f / max);
            if (delta == 0) {
                return new int[]{0, saturation, max};
            }
            float hue;
            if (max == red) {
                hue = 60f * (green - blue) / delta;
            } else if (max == green) {
                hue = 120f + 60f * (blue - red) / delta;
            } else {
                hue = 240f + 60f * (red - green) / delta;
            }
            if (hue < 0) {
                hue += 360f;
            }
            int scaled = Math.round(hue / 2f);
            return new int[]{scaled > MAX_HUE ? 0 : scaled, saturation, max};
        }

        private static boolean inChannel(int channel) {
            return channel >= 0 && channel <= MAX_CHANNEL;
        }
    }
}
