package com.example.slideshow_backend.playlist;

/**
 * Display-shape bucket derived from an image's pixel aspect ratio.
 */
public enum ShapeCategory {
    LANDSCAPE("16:9"),
    SQUARE("1:1"),
    PORTRAIT("9:16"),
    UNCLASSIFIABLE("unknown");

    private final String aspectRatio;

    ShapeCategory(String aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    /**
     * Nominal aspect ratio label used by the display client.
     *
     * @return ratio label such as {@code "16:9"}.
     */
    public String aspectRatio() {
        return aspectRatio;
    }
}
