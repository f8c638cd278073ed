package com.sdmarker.domain.marker.model;

import java.util.List;

/**
 * Weighted token and pattern set for one polarity of a category.
 *
 * @param category the owning category
 * @param polarity positive or negative valence
 * @param weight   contribution per firing marker (negative blocks are negative by convention, not enforced)
 * @param tokens   lower-cased literal tokens, unique, in declaration order
 * @param patterns regex sources with trailing comments already stripped, in declaration order
 */
public record PolarityBlock(
        Category category,
        Polarity polarity,
        double weight,
        List<String> tokens,
        List<String> patterns
) {
    public PolarityBlock {
        tokens = List.copyOf(tokens);
        patterns = List.copyOf(patterns);
    }

    public int markerCount() {
        return tokens.size() + patterns.size();
    }
}
