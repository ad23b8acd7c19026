package com.example.slideshow_backend.playlist;

/**
 * Pixel dimensions recorded for a submission. Any value may be missing for older submissions.
 *
 * @param finalWidth     width of the composed (framed) image.
 * @param finalHeight    height of the composed (framed) image.
 * @param originalWidth  width of the photo as captured or uploaded.
 * @param originalHeight height of the photo as captured or uploaded.
 */
public record ImageDimensions(Integer finalWidth,
                              Integer finalHeight,
                              Integer originalWidth,
                              Integer originalHeight) {

    public static ImageDimensions unknown() {
        return new ImageDimensions(null, null, null, null);
    }

    public static ImageDimensions of(int width, int height) {
        return new ImageDimensions(width, height, null, null);
    }

    /**
     * Resolves the width to display, preferring the composed image over the original.
     *
     * @param fallback width used when neither value is positive.
     * @return a positive width.
     */
    public int resolveWidth(int fallback) {
        return firstPositive(finalWidth, originalWidth, fallback);
    }

    /**
     * Resolves the height to display, preferring the composed image over the original.
     *
     * @param fallback height used when neither value is positive.
     * @return a positive height.
     */
    public int resolveHeight(int fallback) {
        return firstPositive(finalHeight, originalHeight, fallback);
    }

    private static int firstPositive(Integer preferred, Integer secondary, int fallback) {
        if (preferred != null && preferred > 0) {
            return preferred;
        }
        if (secondary != null && secondary > 0) {
            return secondary;
        }
        return fallback;
    }
}
