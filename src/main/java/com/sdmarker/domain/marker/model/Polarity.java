package com.sdmarker.domain.marker.model;

public enum Polarity {
    POSITIVE("Positive"),
    NEGATIVE("Negative");

    private final String configKey;

    Polarity(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }
}
