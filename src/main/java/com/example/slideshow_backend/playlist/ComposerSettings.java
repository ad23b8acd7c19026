package com.example.slideshow_backend.playlist;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layout configuration for the {@link PlaylistComposer}.
 *
 * @param fallbackWidth  width assumed for submissions without recorded dimensions.
 * @param fallbackHeight height assumed for submissions without recorded dimensions.
 * @param groupSizes     images per display unit for each category; {@code 1} means single units.
 * @param priority       order in which categories are offered a slot within one round.
 */
public record ComposerSettings(int fallbackWidth,
                               int fallbackHeight,
                               Map<ShapeCategory, Integer> groupSizes,
                               List<ShapeCategory> priority) {

    public static final int DEFAULT_FALLBACK_WIDTH = 1920;
    public static final int DEFAULT_FALLBACK_HEIGHT = 1080;
    public static final int DEFAULT_LANDSCAPE_GROUP = 1;
    public static final int DEFAULT_PORTRAIT_GROUP = 3;
    public static final int DEFAULT_SQUARE_GROUP = 6;
    public static final List<ShapeCategory> DEFAULT_PRIORITY =
            List.of(ShapeCategory.LANDSCAPE, ShapeCategory.PORTRAIT, ShapeCategory.SQUARE);

    public ComposerSettings {
        if (fallbackWidth <= 0 || fallbackHeight <= 0) {
            throw new IllegalArgumentException("fallback dimensions must be positive");
        }
        if (priority == null || priority.isEmpty()) {
            throw new IllegalArgumentException("priority must name at least one category");
        }
        if (priority.contains(ShapeCategory.UNCLASSIFIABLE)) {
            throw new IllegalArgumentException("UNCLASSIFIABLE cannot be scheduled");
        }
        if (priority.stream().distinct().count() != priority.size()) {
            throw new IllegalArgumentException("priority contains duplicates: " + priority);
        }
        Map<ShapeCategory, Integer> sizes = new EnumMap<>(ShapeCategory.class);
        for (ShapeCategory category : priority) {
            Integer size = groupSizes == null ? null : groupSizes.get(category);
            if (size == null || size < 1) {
                throw new IllegalArgumentException("group size for " + category + " must be >= 1");
            }
            sizes.put(category, size);
        }
        groupSizes = Map.copyOf(sizes);
        priority = List.copyOf(priority);
    }

    /**
     * Full-HD landscape fallback, singles for landscape, 3-up portrait and 6-up square mosaics.
     *
     * @return default settings.
     */
    public static ComposerSettings defaults() {
        return new ComposerSettings(DEFAULT_FALLBACK_WIDTH, DEFAULT_FALLBACK_HEIGHT,
                Map.of(ShapeCategory.LANDSCAPE, DEFAULT_LANDSCAPE_GROUP,
                        ShapeCategory.PORTRAIT, DEFAULT_PORTRAIT_GROUP,
                        ShapeCategory.SQUARE, DEFAULT_SQUARE_GROUP),
                DEFAULT_PRIORITY);
    }

    public int groupSize(ShapeCategory category) {
        return groupSizes.getOrDefault(category, 0);
    }
}
