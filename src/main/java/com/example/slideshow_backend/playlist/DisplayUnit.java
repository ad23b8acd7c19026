package com.example.slideshow_backend.playlist;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One step of the rendered rotation: either a single image or a fixed-size mosaic of same-shape images.
 *
 * @param type        single or mosaic.
 * @param category    shape category shared by every member.
 * @param layout      mosaic layout hint such as {@code "3-up"}, {@code null} for single units.
 * @param submissions members in display order.
 */
public record DisplayUnit(UnitType type,
                          ShapeCategory category,
                          String layout,
                          List<SlideImage> submissions) {

    public DisplayUnit {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(category, "category");
        submissions = List.copyOf(submissions);
    }

    public static DisplayUnit single(ShapeCategory category, SlideImage image) {
        return new DisplayUnit(UnitType.SINGLE, category, null, List.of(image));
    }

    public static DisplayUnit mosaic(ShapeCategory category, List<SlideImage> images) {
        return new DisplayUnit(UnitType.MOSAIC, category, layoutFor(images.size()), images);
    }

    /**
     * Layout hint implied by a mosaic group size.
     *
     * @param groupSize number of images per unit.
     * @return hint in the form {@code "<n>-up"}.
     */
    public static String layoutFor(int groupSize) {
        return groupSize + "-up";
    }

    @JsonProperty("aspectRatio")
    public String aspectRatio() {
        return category.aspectRatio();
    }
}
