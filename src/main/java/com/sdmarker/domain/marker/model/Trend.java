package com.sdmarker.domain.marker.model;

public enum Trend {
    RISING, FALLING, STABLE
}
