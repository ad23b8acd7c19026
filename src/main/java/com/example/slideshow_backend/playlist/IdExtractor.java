package com.example.slideshow_backend.playlist;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a playlist into the ids handed to the play-count writer after display.
 */
@Component
public class IdExtractor {

    public List<String> extract(Playlist playlist) {
        List<String> ids = new ArrayList<>();
        for (DisplayUnit unit : playlist.units()) {
            for (SlideImage image : unit.submissions()) {
                ids.add(image.id());
            }
        }
        return ids;
    }
}
