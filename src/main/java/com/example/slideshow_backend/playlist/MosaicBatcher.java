package com.example.slideshow_backend.playlist;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts an ordered bucket into fixed-size, non-overlapping display units from the front.
 */
@Component
public class MosaicBatcher {

    /**
     * Opens a read cursor over an ordered bucket.
     *
     * @param category  category shared by the bucket.
     * @param ordered   fairness-ordered candidates.
     * @param groupSize images per unit; {@code 1} yields single units.
     * @return cursor positioned at the first candidate.
     */
    public Cursor open(ShapeCategory category, List<Candidate> ordered, int groupSize) {
        if (groupSize < 1) {
            throw new IllegalArgumentException("groupSize must be >= 1 but was " + groupSize);
        }
        return new Cursor(category, ordered, groupSize);
    }

    /**
     * Batches the whole bucket. The remainder smaller than {@code groupSize} is not emitted.
     *
     * @param category  category shared by the bucket.
     * @param ordered   fairness-ordered candidates.
     * @param groupSize images per unit.
     * @return every complete unit in order.
     */
    List<DisplayUnit> batchAll(ShapeCategory category, List<Candidate> ordered, int groupSize) {
        Cursor cursor = open(category, ordered, groupSize);
        List<DisplayUnit> units = new ArrayList<>();
        while (cursor.hasNext()) {
            units.add(cursor.next());
        }
        return units;
    }

    /**
     * Read position within one bucket.
     */
    public static final class Cursor {
        private final ShapeCategory category;
        private final List<Candidate> ordered;
        private final int groupSize;
        private int position;

        private Cursor(ShapeCategory category, List<Candidate> ordered, int groupSize) {
            this.category = category;
            this.ordered = ordered;
            this.groupSize = groupSize;
        }

        public boolean hasNext() {
            return remaining() >= groupSize;
        }

        /**
         * Emits the next unit and advances by the group size.
         *
         * @return the next display unit.
         * @throws IllegalStateException when fewer than {@code groupSize} candidates remain.
         */
        public DisplayUnit next() {
            if (!hasNext()) {
                throw new IllegalStateException("only " + remaining() + " " + category + " left, need " + groupSize);
            }
            List<SlideImage> images = new ArrayList<>(groupSize);
            for (Candidate candidate : ordered.subList(position, position + groupSize)) {
                images.add(candidate.image());
            }
            position += groupSize;
            return groupSize == 1
                    ? DisplayUnit.single(category, images.get(0))
                    : DisplayUnit.mosaic(category, images);
        }

        public int remaining() {
            return ordered.size() - position;
        }
    }
}
