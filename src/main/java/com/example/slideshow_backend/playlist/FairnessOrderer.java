package com.example.slideshow_backend.playlist;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders a bucket so the least-shown, then oldest, submissions come first.
 */
@Component
public class FairnessOrderer {

    static final Comparator<Candidate> FAIRNESS = Comparator
            .comparingInt((Candidate c) -> c.submission().effectivePlayCount())
            .thenComparing(c -> c.submission().createdAt());

    /**
     * Returns a new list sorted ascending by (play count, creation time). The sort is stable, so
     * fully tied candidates keep their input order.
     *
     * @param bucket candidates of one category.
     * @return ordered copy.
     */
    public List<Candidate> order(List<Candidate> bucket) {
        List<Candidate> ordered = new ArrayList<>(bucket);
        ordered.sort(FAIRNESS);
        return ordered;
    }
}
