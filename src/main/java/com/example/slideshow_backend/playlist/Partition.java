package com.example.slideshow_backend.playlist;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of splitting a candidate pool by shape.
 *
 * @param buckets      order-preserving candidates per schedulable category.
 * @param unclassified candidates that cannot be scheduled; callers report these.
 * @param duplicates   number of pool entries skipped because their id was already seen.
 */
public record Partition(Map<ShapeCategory, List<Candidate>> buckets,
                        List<Candidate> unclassified,
                        int duplicates) {

    public Partition {
        Map<ShapeCategory, List<Candidate>> copy = new EnumMap<>(ShapeCategory.class);
        buckets.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        buckets = copy;
        unclassified = List.copyOf(unclassified);
    }

    public List<Candidate> bucket(ShapeCategory category) {
        return buckets.getOrDefault(category, List.of());
    }

    public int scheduledCount() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }
}
