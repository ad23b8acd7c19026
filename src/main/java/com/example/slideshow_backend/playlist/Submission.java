package com.example.slideshow_backend.playlist;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-only snapshot of a user submission as queried by the caller.
 *
 * @param id            submission identifier.
 * @param imageUrl      preferred image reference.
 * @param finalImageUrl composed image reference, used when {@code imageUrl} is blank.
 * @param metadata      recorded pixel dimensions, possibly incomplete.
 * @param playCount     number of prior display occurrences; {@code null} counts as zero.
 * @param createdAt     creation timestamp, required.
 */
public record Submission(String id,
                         String imageUrl,
                         String finalImageUrl,
                         ImageDimensions metadata,
                         Integer playCount,
                         Instant createdAt) {

    public Submission {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        if (metadata == null) {
            metadata = ImageDimensions.unknown();
        }
    }

    /**
     * Fairness counter used for ordering.
     *
     * @return play count, never negative.
     */
    public int effectivePlayCount() {
        return playCount == null ? 0 : Math.max(0, playCount);
    }

    public String imageReference() {
        if (imageUrl != null && !imageUrl.isBlank()) {
            return imageUrl;
        }
        return finalImageUrl;
    }

    /**
     * Builds the display view of this submission with missing dimensions replaced by the fallback size.
     *
     * @param fallbackWidth  width applied when no positive width is recorded.
     * @param fallbackHeight height applied when no positive height is recorded.
     * @return image reference with normalized dimensions.
     */
    public SlideImage toSlideImage(int fallbackWidth, int fallbackHeight) {
        return new SlideImage(id,
                imageReference(),
                metadata.resolveWidth(fallbackWidth),
                metadata.resolveHeight(fallbackHeight));
    }
}
