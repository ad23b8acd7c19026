package com.example.slideshow_backend.playlist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AspectClassifierTest {

    private final AspectClassifier classifier = new AspectClassifier();

    @ParameterizedTest(name = "{0}x{1} -> {2}")
    @CsvSource({
            "400, 1000, PORTRAIT",
            "700, 1000, PORTRAIT",
            "1080, 1920, PORTRAIT",
            "800, 1000, SQUARE",
            "1200, 1000, SQUARE",
            "1080, 1080, SQUARE",
            "1201, 1000, LANDSCAPE",
            "1920, 1080, LANDSCAPE",
            "399, 1000, LANDSCAPE",
            "100, 1000, LANDSCAPE",
            "750, 1000, LANDSCAPE",
            "5000, 1000, LANDSCAPE"
    })
    void classifiesByRatioBands(int width, int height, ShapeCategory expected) {
        assertThat(classifier.classify(width, height)).isEqualTo(expected);
    }

    @Test
    void nonPositiveDimensionsFallBackToLandscape() {
        assertThat(classifier.classify(0, 1080)).isEqualTo(ShapeCategory.LANDSCAPE);
        assertThat(classifier.classify(1080, 0)).isEqualTo(ShapeCategory.LANDSCAPE);
        assertThat(classifier.classify(-5, -5)).isEqualTo(ShapeCategory.LANDSCAPE);
    }

    @Test
    void neverReturnsUnclassifiable() {
        for (int width = 1; width <= 3000; width += 37) {
            for (int height = 1; height <= 3000; height += 41) {
                assertThat(classifier.classify(width, height)).isNotEqualTo(ShapeCategory.UNCLASSIFIABLE);
            }
        }
    }

    @Test
    void missingDimensionsAreNormalizedBeforeClassification() {
        Submission legacy = new Submission("legacy", "u", null,
                new ImageDimensions(0, null, null, null), null, Submissions.BASE);

        SlideImage image = legacy.toSlideImage(1920, 1080);

        assertThat(image.width()).isEqualTo(1920);
        assertThat(image.height()).isEqualTo(1080);
        assertThat(classifier.classify(image)).isEqualTo(ShapeCategory.LANDSCAPE);
    }
}
