package com.example.slideshow_backend.dto;

import com.example.slideshow_backend.playlist.DisplayUnit;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Single best next slide for a rolling buffer.
 *
 * @param candidate      next unit, or {@code null} if none can be formed.
 * @param submissionIds  member ids of the candidate.
 * @param totalAvailable candidates considered after exclusions.
 * @param message        hint when no candidate is available.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextCandidateResponse(DisplayUnit candidate,
                                    List<String> submissionIds,
                                    int totalAvailable,
                                    String message) {
}
