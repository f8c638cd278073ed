package com.sdmarker.domain.marker.exception;

public class AnalysisCancelledException extends MarkerEngineException {
    public AnalysisCancelledException(int processedUnits, int totalUnits) {
        super(String.format("Analysis cancelled after %d of %d text units", processedUnits, totalUnits));
    }
}
