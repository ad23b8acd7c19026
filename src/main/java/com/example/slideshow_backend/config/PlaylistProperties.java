package com.example.slideshow_backend.config;

import com.example.slideshow_backend.playlist.ComposerSettings;
import com.example.slideshow_backend.playlist.ShapeCategory;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Playlist sizing and mosaic layout settings.
 */
@Validated
@ConfigurationProperties(prefix = "slideshow.playlist")
public class PlaylistProperties {

    @Min(1)
    private int defaultLimit = 10;
    @Min(1)
    private int maxLimit = 50;
    @Min(1)
    private int fallbackWidth = ComposerSettings.DEFAULT_FALLBACK_WIDTH;
    @Min(1)
    private int fallbackHeight = ComposerSettings.DEFAULT_FALLBACK_HEIGHT;
    @Min(1)
    private int landscapeGroupSize = ComposerSettings.DEFAULT_LANDSCAPE_GROUP;
    @Min(1)
    private int portraitGroupSize = ComposerSettings.DEFAULT_PORTRAIT_GROUP;
    @Min(1)
    private int squareGroupSize = ComposerSettings.DEFAULT_SQUARE_GROUP;
    @NotEmpty
    private List<ShapeCategory> priority = new ArrayList<>(ComposerSettings.DEFAULT_PRIORITY);
    // pool entries traced at debug level per request
    @Min(0)
    private int logHead = 15;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getFallbackWidth() {
        return fallbackWidth;
    }

    public void setFallbackWidth(int fallbackWidth) {
        this.fallbackWidth = fallbackWidth;
    }

    public int getFallbackHeight() {
        return fallbackHeight;
    }

    public void setFallbackHeight(int fallbackHeight) {
        this.fallbackHeight = fallbackHeight;
    }

    public int getLandscapeGroupSize() {
        return landscapeGroupSize;
    }

    public void setLandscapeGroupSize(int landscapeGroupSize) {
        this.landscapeGroupSize = landscapeGroupSize;
    }

    public int getPortraitGroupSize() {
        return portraitGroupSize;
    }

    public void setPortraitGroupSize(int portraitGroupSize) {
        this.portraitGroupSize = portraitGroupSize;
    }

    public int getSquareGroupSize() {
        return squareGroupSize;
    }

    public void setSquareGroupSize(int squareGroupSize) {
        this.squareGroupSize = squareGroupSize;
    }

    public List<ShapeCategory> getPriority() {
        return priority;
    }

    public void setPriority(List<ShapeCategory> priority) {
        this.priority = priority;
    }

    public int getLogHead() {
        return logHead;
    }

    public void setLogHead(int logHead) {
        this.logHead = logHead;
    }
}
