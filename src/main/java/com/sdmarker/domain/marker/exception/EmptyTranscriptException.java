package com.sdmarker.domain.marker.exception;

public class EmptyTranscriptException extends MarkerEngineException {
    public EmptyTranscriptException() {
        super("Transcript contains no text units; nothing to aggregate.");
    }
}
