package com.example.slideshow_backend.dto.web;

import com.example.slideshow_backend.playlist.ImageDimensions;
import com.example.slideshow_backend.playlist.Submission;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Candidate submission as supplied by the caller, already filtered to visible, non-archived entries.
 */
public record SubmissionPayload(@NotBlank String id,
                                String imageUrl,
                                String finalImageUrl,
                                Integer finalWidth,
                                Integer finalHeight,
                                Integer originalWidth,
                                Integer originalHeight,
                                Integer playCount,
                                @NotNull Instant createdAt) {

    public Submission toSubmission() {
        return new Submission(id, imageUrl, finalImageUrl,
                new ImageDimensions(finalWidth, finalHeight, originalWidth, originalHeight),
                playCount, createdAt);
    }
}
