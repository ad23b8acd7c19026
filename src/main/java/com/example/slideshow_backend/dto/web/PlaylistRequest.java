package com.example.slideshow_backend.dto.web;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Request payload for composing a playlist.
 *
 * @param limit       optional number of display units; defaults to the configured buffer size.
 * @param excludeIds  submissions currently buffered in other active playlists.
 * @param submissions candidate pool, sorted or not.
 */
public record PlaylistRequest(Integer limit,
                              List<String> excludeIds,
                              @Valid List<SubmissionPayload> submissions) {
}
