package com.sdmarker.domain.marker.model;

public enum MarkerKind {
    // Whole-word match
    TOKEN,
    // Regex match anywhere in the text
    PATTERN
}
