package com.example.slideshow_backend.service;

import com.example.slideshow_backend.dto.NextCandidateResponse;
import com.example.slideshow_backend.dto.PlaylistResponse;
import com.example.slideshow_backend.playlist.Submission;
import jakarta.annotation.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * Service composing slideshow playlists from a caller-supplied candidate pool.
 */
public interface PlaylistService {

    /**
     * Composes the next playlist.
     *
     * @param pool       candidate submissions.
     * @param limit      requested number of display units; {@code null} selects the configured default,
     *                   larger values are capped, {@code limit <= 0} yields an empty playlist.
     * @param excludeIds ids already shown by other active playlists.
     * @return playlist together with its flattened submission ids.
     */
    PlaylistResponse generate(List<Submission> pool, @Nullable Integer limit, @Nullable Collection<String> excludeIds);

    /**
     * Picks one display unit to append to a rolling buffer.
     *
     * @param pool       candidate submissions.
     * @param excludeIds ids already in the buffer.
     * @return the candidate, or an empty response with a message.
     */
    NextCandidateResponse nextCandidate(List<Submission> pool, @Nullable Collection<String> excludeIds);
}
