package com.example.slideshow_backend.playlist;

import java.util.List;

/**
 * Ordered display units for one refresh. The order is the display sequence.
 */
public record Playlist(List<DisplayUnit> units) {

    private static final Playlist EMPTY = new Playlist(List.of());

    public Playlist {
        units = List.copyOf(units);
    }

    public static Playlist empty() {
        return EMPTY;
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }
}
