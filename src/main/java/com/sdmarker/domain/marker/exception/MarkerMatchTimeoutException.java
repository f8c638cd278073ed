package com.sdmarker.domain.marker.exception;

/**
 * A marker regex exceeded its matching time budget, typically catastrophic backtracking.
 */
public class MarkerMatchTimeoutException extends MarkerEngineException {

    private final String pattern;

    public MarkerMatchTimeoutException(String pattern, long timeoutMillis) {
        super(String.format("Marker pattern \"%s\" exceeded match timeout of %d ms", pattern, timeoutMillis));
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
