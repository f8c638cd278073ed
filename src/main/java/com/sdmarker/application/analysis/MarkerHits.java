package com.sdmarker.application.analysis;

import com.sdmarker.domain.marker.model.Category;
import com.sdmarker.domain.marker.model.Polarity;

/**
 * Total occurrences of one marker across a transcript.
 */
public record MarkerHits(Category category, Polarity polarity, String marker, int hits) {}
