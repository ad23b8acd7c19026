package com.example.slideshow_backend.playlist;

/**
 * Member of a display unit as exposed to the display client.
 *
 * @param id       submission identifier.
 * @param imageUrl image reference.
 * @param width    normalized pixel width.
 * @param height   normalized pixel height.
 */
public record SlideImage(String id, String imageUrl, int width, int height) {
}
