package com.sdmarker.domain.marker.exception;

/**
 * Structurally invalid marker configuration. No partial marker set is produced.
 */
public class MarkerConfigException extends MarkerEngineException {

    public MarkerConfigException(String message) {
        super(message);
    }

    public MarkerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
