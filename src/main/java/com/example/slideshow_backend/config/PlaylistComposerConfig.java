package com.example.slideshow_backend.config;

import com.example.slideshow_backend.playlist.ComposerSettings;
import com.example.slideshow_backend.playlist.ShapeCategory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

@Configuration
public class PlaylistComposerConfig {

    @Bean
    public ComposerSettings composerSettings(PlaylistProperties props) {
        return new ComposerSettings(
                props.getFallbackWidth(),
                props.getFallbackHeight(),
                Map.of(ShapeCategory.LANDSCAPE, props.getLandscapeGroupSize(),
                        ShapeCategory.PORTRAIT, props.getPortraitGroupSize(),
                        ShapeCategory.SQUARE, props.getSquareGroupSize()),
                props.getPriority());
    }
}
