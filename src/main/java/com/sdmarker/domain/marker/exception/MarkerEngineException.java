package com.sdmarker.domain.marker.exception;

public class MarkerEngineException extends RuntimeException {

    public MarkerEngineException(String message) {
        super(message);
    }

    public MarkerEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
