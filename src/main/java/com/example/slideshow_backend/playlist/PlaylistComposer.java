package com.example.slideshow_backend.playlist;

import java.util.List;

/**
 * Composes the ordered display units for one slideshow refresh.
 */
public interface PlaylistComposer {
    /**
     * Builds a playlist from a snapshot of the candidate pool. Never fails on well-formed submissions;
     * an empty playlist is a normal outcome.
     *
     * @param pool  candidate submissions, already filtered to visible ones.
     * @param limit maximum number of display units; {@code limit <= 0} yields an empty playlist.
     * @return playlist in display order.
     */
    Playlist compose(List<Submission> pool, int limit);
}
