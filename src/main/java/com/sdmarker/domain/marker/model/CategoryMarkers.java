package com.sdmarker.domain.marker.model;

/**
 * A category with its two polarity blocks.
 */
public record CategoryMarkers(
        Category category,
        PolarityBlock positive,
        PolarityBlock negative
) {}
