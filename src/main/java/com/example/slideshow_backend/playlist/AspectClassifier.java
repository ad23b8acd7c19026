package com.example.slideshow_backend.playlist;

import org.springframework.stereotype.Component;

/**
 * Maps pixel dimensions to a {@link ShapeCategory} using tolerant ratio bands. Anything outside the
 * portrait and square bands is shown as landscape.
 */
@Component
public class AspectClassifier {
    static final double PORTRAIT_MIN = 0.4;
    static final double PORTRAIT_MAX = 0.7;
    static final double SQUARE_MIN = 0.8;
    static final double SQUARE_MAX = 1.2;

    /**
     * Classifies the given dimensions. Never returns {@link ShapeCategory#UNCLASSIFIABLE}.
     *
     * @param width  pixel width; non-positive values are treated as the landscape placeholder.
     * @param height pixel height; non-positive values are treated as the landscape placeholder.
     * @return the display-shape category.
     */
    public ShapeCategory classify(int width, int height) {
        if (width <= 0 || height <= 0) {
            return ShapeCategory.LANDSCAPE;
        }
        double ratio = (double) width / height;
        if (ratio >= PORTRAIT_MIN && ratio <= PORTRAIT_MAX) {
            return ShapeCategory.PORTRAIT;
        }
        if (ratio >= SQUARE_MIN && ratio <= SQUARE_MAX) {
            return ShapeCategory.SQUARE;
        }
        return ShapeCategory.LANDSCAPE;
    }

    public ShapeCategory classify(SlideImage image) {
        return classify(image.width(), image.height());
    }
}
