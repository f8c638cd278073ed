package com.sdmarker.domain.marker.exception;

import com.sdmarker.domain.marker.model.Category;
import com.sdmarker.domain.marker.model.Polarity;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more marker patterns failed to compile. Holds a single error in fail-fast mode.
 */
public class PatternCompileException extends MarkerEngineException {

    private final List<PatternCompileError> errors;

    public PatternCompileException(List<PatternCompileError> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<PatternCompileError> errors() {
        return errors;
    }

    public Category category() {
        return errors.get(0).category();
    }

    public Polarity polarity() {
        return errors.get(0).polarity();
    }

    public String pattern() {
        return errors.get(0).pattern();
    }

    private static String buildMessage(List<PatternCompileError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("PatternCompileException requires at least one error");
        }
        return errors.size() + " invalid marker pattern(s): " + errors.stream()
                .map(e -> e.location() + " \"" + e.pattern() + "\" (" + e.description()
                        + (e.index() >= 0 ? " near index " + e.index() : "") + ")")
                .collect(Collectors.joining("; "));
    }
}
