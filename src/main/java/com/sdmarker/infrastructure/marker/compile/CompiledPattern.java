package com.sdmarker.infrastructure.marker.compile;

import com.sdmarker.domain.marker.model.MarkerKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A validated marker regex. {@link Pattern} is immutable and thread-safe; every caller gets its own {@link Matcher}.
 *
 * @param source  marker as declared in the configuration
 * @param kind    token (whole-word) or pattern (anywhere)
 * @param pattern compiled regex
 */
public record CompiledPattern(String source, MarkerKind kind, Pattern pattern) {

    public Matcher matcher(CharSequence text) {
        return pattern.matcher(text);
    }
}
