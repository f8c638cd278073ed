package com.sdmarker.domain.marker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-text scores for every declared category, in declaration order.
 */
public record ScoreResult(Map<Category, Double> scores, List<MatchEvent> matches) {

    public ScoreResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        matches = List.copyOf(matches);
    }

    public double score(Category category) {
        Double value = scores.get(category);
        if (value == null) {
            throw new IllegalArgumentException("Category not declared in this result: " + category);
        }
        return value;
    }
}
