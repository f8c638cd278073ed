package com.sdmarker.infrastructure.marker.compile;

import com.sdmarker.domain.marker.exception.PatternCompileError;
import com.sdmarker.domain.marker.exception.PatternCompileException;
import com.sdmarker.domain.marker.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles marker sources into reusable case-insensitive matchers.
 *
 * Tokens become whole-word matches: plain tokens are quoted literally, tokens carrying regex
 * metacharacters (e.g. "burn.?out") are used as regex fragments. Word edges are Unicode letters
 * and digits, so umlauts count as word characters.
 */
@Slf4j
@Component
public class PatternCompiler {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}_])";
    private static final Pattern REGEX_META = Pattern.compile("[.?*+\\[\\](){}|^$\\\\]");

    private final CompileMode mode;

    @Autowired
    public PatternCompiler(@Value("${markers.compile-mode:COLLECT_ALL}") CompileMode mode) {
        this.mode = mode;
    }

    public PatternCompiler() {
        this(CompileMode.COLLECT_ALL);
    }

    public CompiledMarkerSet compile(MarkerSet markerSet) {
        ErrorCollector errors = new ErrorCollector(mode);
        List<CompiledCategory> categories = new ArrayList<>();

        for (CategoryMarkers markers : markerSet.categories()) {
            categories.add(new CompiledCategory(
                    markers.category(),
                    compileBlock(markers.positive(), errors),
                    compileBlock(markers.negative(), errors)));
        }

        errors.throwIfAny();
        log.info("[PatternCompiler] Compiled {} categories", categories.size());
        return new CompiledMarkerSet(categories);
    }

    public CompiledMarkerGroups compileGroups(MarkerSet markerSet) {
        ErrorCollector errors = new ErrorCollector(mode);
        List<CompiledMarkerGroup> groups = new ArrayList<>();

        for (MarkerGroup group : markerSet.groups()) {
            List<CompiledPattern> patterns = new ArrayList<>();
            for (String source : group.patterns()) {
                try {
                    patterns.add(new CompiledPattern(source, MarkerKind.PATTERN, Pattern.compile(source, FLAGS)));
                } catch (PatternSyntaxException e) {
                    errors.add(new PatternCompileError(null, null, group.name(), source, e.getDescription(), e.getIndex()));
                }
            }
            groups.add(new CompiledMarkerGroup(group.name(), patterns));
        }

        errors.throwIfAny();
        log.info("[PatternCompiler] Compiled {} drift groups", groups.size());
        return new CompiledMarkerGroups(groups);
    }

    private CompiledBlock compileBlock(PolarityBlock block, ErrorCollector errors) {
        List<CompiledPattern> tokens = new ArrayList<>();
        for (String token : block.tokens()) {
            try {
                tokens.add(new CompiledPattern(token, MarkerKind.TOKEN, Pattern.compile(tokenRegex(token), FLAGS)));
            } catch (PatternSyntaxException e) {
                errors.add(new PatternCompileError(block.category(), block.polarity(), null, token,
                        e.getDescription(), tokenIndex(token, e.getIndex())));
            }
        }

        List<CompiledPattern> patterns = new ArrayList<>();
        for (String source : block.patterns()) {
            try {
                patterns.add(new CompiledPattern(source, MarkerKind.PATTERN, Pattern.compile(source, FLAGS)));
            } catch (PatternSyntaxException e) {
                errors.add(new PatternCompileError(block.category(), block.polarity(), null, source,
                        e.getDescription(), e.getIndex()));
            }
        }

        return new CompiledBlock(block.polarity(), block.weight(), tokens, patterns);
    }

    static String tokenRegex(String token) {
        String body = REGEX_META.matcher(token).find() ? "(?:" + token + ")" : Pattern.quote(token);
        return WORD_START + body + WORD_END;
    }

    // Maps an error index in the word-bounded token regex back to the token source.
    private static int tokenIndex(String token, int regexIndex) {
        int index = regexIndex - WORD_START.length() - "(?:".length();
        return index >= 0 && index <= token.length() ? index : -1;
    }

    private static final class ErrorCollector {
        private final CompileMode mode;
        private final List<PatternCompileError> errors = new ArrayList<>();

        ErrorCollector(CompileMode mode) {
            this.mode = mode;
        }

        void add(PatternCompileError error) {
            log.warn("[PatternCompiler] Invalid pattern in {}: \"{}\" ({}, index {})",
                    error.location(), error.pattern(), error.description(), error.index());
            errors.add(error);
            if (mode == CompileMode.FAIL_FAST) {
                throw new PatternCompileException(errors);
            }
        }

        void throwIfAny() {
            if (!errors.isEmpty()) {
                throw new PatternCompileException(errors);
            }
        }
    }
}
