package com.sdmarker.domain.marker.model;

/**
 * A single marker that fired during one scan.
 *
 * @param category    category the marker belongs to
 * @param polarity    polarity block of the marker
 * @param kind        token or pattern
 * @param marker      marker source as declared
 * @param offset      start offset of the first occurrence in the scanned text
 * @param occurrences number of occurrences found (1 in presence mode)
 * @param contribution weight added to the category score
 */
public record MatchEvent(
        Category category,
        Polarity polarity,
        MarkerKind kind,
        String marker,
        int offset,
        int occurrences,
        double contribution
) {}
