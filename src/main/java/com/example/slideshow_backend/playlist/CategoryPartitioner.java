package com.example.slideshow_backend.playlist;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a candidate pool into per-category buckets, preserving input order within each bucket.
 */
@Component
public class CategoryPartitioner {

    private final AspectClassifier classifier;

    public CategoryPartitioner(AspectClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Partitions the pool. Each submission id is placed at most once; later duplicates are counted and skipped.
     *
     * @param pool     candidate submissions.
     * @param settings supplies the fallback size for missing dimensions.
     * @return buckets for landscape, square and portrait plus anything unclassifiable.
     */
    public Partition partition(List<Submission> pool, ComposerSettings settings) {
        Map<ShapeCategory, List<Candidate>> buckets = new EnumMap<>(ShapeCategory.class);
        buckets.put(ShapeCategory.LANDSCAPE, new ArrayList<>());
        buckets.put(ShapeCategory.SQUARE, new ArrayList<>());
        buckets.put(ShapeCategory.PORTRAIT, new ArrayList<>());
        List<Candidate> unclassified = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;

        for (Submission submission : pool) {
            if (submission == null) {
                continue;
            }
            if (!seen.add(submission.id())) {
                duplicates++;
                continue;
            }
            SlideImage image = submission.toSlideImage(settings.fallbackWidth(), settings.fallbackHeight());
            ShapeCategory category = classifier.classify(image);
            Candidate candidate = new Candidate(submission, image, category);
            if (category == ShapeCategory.UNCLASSIFIABLE) {
                unclassified.add(candidate);
            } else {
                buckets.get(category).add(candidate);
            }
        }
        return new Partition(buckets, unclassified, duplicates);
    }
}
