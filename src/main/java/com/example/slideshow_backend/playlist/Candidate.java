package com.example.slideshow_backend.playlist;

/**
 * Submission paired with its normalized display view and derived category.
 *
 * @param submission source submission, used for fairness ordering.
 * @param image      normalized image handed to display units.
 * @param category   classified shape.
 */
public record Candidate(Submission submission, SlideImage image, ShapeCategory category) {
}
