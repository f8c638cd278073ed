package com.sdmarker.domain.marker.model;

/**
 * How repeated occurrences of one marker inside a single text contribute to its category score.
 */
public enum ScoringMode {
    /** Each firing marker contributes its block weight once. */
    PRESENCE,
    /** Each occurrence contributes its block weight. */
    FREQUENCY
}
