package com.example.slideshow_backend.controller;

import com.example.slideshow_backend.dto.NextCandidateResponse;
import com.example.slideshow_backend.dto.PlaylistResponse;
import com.example.slideshow_backend.dto.web.NextCandidateRequest;
import com.example.slideshow_backend.dto.web.PlaylistRequest;
import com.example.slideshow_backend.dto.web.SubmissionPayload;
import com.example.slideshow_backend.playlist.Submission;
import com.example.slideshow_backend.service.PlaylistService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Objects;

/**
 * REST controller exposing slideshow playlist composition.
 */
@RestController
@RequestMapping("/v1/playlists")
public class PlaylistController {

    private final PlaylistService playlistService;

    public PlaylistController(PlaylistService playlistService) {
        this.playlistService = playlistService;
    }

    /**
     * Composes the next slides from the supplied candidate pool.
     *
     * @param body candidate pool with optional limit and exclusions.
     * @return playlist plus the ids to report as played once displayed.
     */
    @PostMapping
    public PlaylistResponse generate(@Valid @RequestBody PlaylistRequest body) {
        List<Submission> pool = toPool(body.submissions());
        return playlistService.generate(pool, body.limit(), body.excludeIds());
    }

    /**
     * Returns the single best slide to append to a rolling buffer.
     *
     * @param body candidate pool and the ids already buffered.
     * @return next candidate or an empty response.
     */
    @PostMapping("/next-candidate")
    public NextCandidateResponse nextCandidate(@Valid @RequestBody NextCandidateRequest body) {
        List<Submission> pool = toPool(body.submissions());
        return playlistService.nextCandidate(pool, body.excludeIds());
    }

    private static List<Submission> toPool(List<SubmissionPayload> submissions) {
        if (submissions == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "SUBMISSIONS_REQUIRED");
        }
        return submissions.stream()
                .filter(Objects::nonNull)
                .map(SubmissionPayload::toSubmission)
                .toList();
    }
}
