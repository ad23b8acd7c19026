package com.example.slideshow_backend.config;

import com.example.slideshow_backend.playlist.ComposerSettings;
import com.example.slideshow_backend.playlist.DisplayUnit;
import com.example.slideshow_backend.playlist.ShapeCategory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator playlistHealth(ComposerSettings settings, PlaylistProperties props) {
        return () -> {
            Health.Builder builder = Health.up()
                    .withDetail("priority", settings.priority())
                    .withDetail("defaultLimit", props.getDefaultLimit())
                    .withDetail("maxLimit", props.getMaxLimit());
            for (ShapeCategory category : settings.priority()) {
                int size = settings.groupSize(category);
                builder.withDetail(category.name().toLowerCase(Locale.ROOT), size == 1 ? "single" : DisplayUnit.layoutFor(size));
            }
            return builder.build();
        };
    }
}
