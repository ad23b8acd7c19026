package com.example.slideshow_backend.dto;

import com.example.slideshow_backend.playlist.DisplayUnit;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response payload for playlist composition.
 *
 * @param count            number of display units.
 * @param totalSubmissions candidates considered after exclusions.
 * @param playlist         display units in display order.
 * @param submissionIds    member ids in display order, for the play-count writer.
 * @param message          hint when nothing could be scheduled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaylistResponse(int count,
                               int totalSubmissions,
                               List<DisplayUnit> playlist,
                               List<String> submissionIds,
                               String message) {
}
