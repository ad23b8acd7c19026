package com.example.slideshow_backend.dto.web;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Request payload for picking the next slide of a rolling buffer.
 *
 * @param excludeIds  submissions already in the buffer.
 * @param submissions candidate pool.
 */
public record NextCandidateRequest(List<String> excludeIds,
                                   @Valid List<SubmissionPayload> submissions) {
}
