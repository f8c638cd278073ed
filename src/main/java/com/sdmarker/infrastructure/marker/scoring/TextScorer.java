package com.sdmarker.infrastructure.marker.scoring;

import com.sdmarker.domain.marker.model.*;
import com.sdmarker.infrastructure.marker.compile.CompiledBlock;
import com.sdmarker.infrastructure.marker.compile.CompiledCategory;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerSet;
import com.sdmarker.infrastructure.marker.compile.CompiledPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Scores one text against every category of a compiled marker set.
 *
 * Scoring rules:
 *   - tokens match as whole words, patterns match anywhere, both case-insensitive
 *   - a firing marker adds its block weight once (PRESENCE) or once per occurrence (FREQUENCY)
 *   - positive and negative contributions of a category are summed and may cancel
 *   - categories without hits score 0.0; every declared category is present in the result
 *
 * Stateless apart from configuration; safe to call from several threads at once.
 */
@Slf4j
@Component
public class TextScorer {

    private final ScoringMode scoringMode;
    private final long matchTimeoutMillis;

    @Autowired
    public TextScorer(@Value("${markers.scoring-mode:PRESENCE}") ScoringMode scoringMode,
                      @Value("${markers.match-timeout-ms:250}") long matchTimeoutMillis) {
        this.scoringMode = scoringMode;
        this.matchTimeoutMillis = matchTimeoutMillis;
    }

    public TextScorer() {
        this(ScoringMode.PRESENCE, 250);
    }

    public ScoreResult score(String text, CompiledMarkerSet markers) {
        Map<Category, Double> scores = new LinkedHashMap<>();
        for (CompiledCategory category : markers.categories()) {
            scores.put(category.category(), 0.0);
        }
        if (text == null || text.isEmpty()) {
            return new ScoreResult(scores, List.of());
        }

        List<MatchEvent> matches = new ArrayList<>();
        for (CompiledCategory category : markers.categories()) {
            double total = scanBlock(category.category(), category.positive(), text, matches)
                    + scanBlock(category.category(), category.negative(), text, matches);
            scores.put(category.category(), total);
        }

        if (log.isDebugEnabled() && !matches.isEmpty()) {
            log.debug("[TextScorer] {} markers fired in text of length {}: {}", matches.size(), text.length(), scores);
        }
        return new ScoreResult(scores, matches);
    }

    private double scanBlock(Category category, CompiledBlock block, String text, List<MatchEvent> matches) {
        double sum = 0.0;
        for (CompiledPattern token : block.tokens()) {
            sum += scanMarker(category, block, token, text, matches);
        }
        for (CompiledPattern pattern : block.patterns()) {
            sum += scanMarker(category, block, pattern, text, matches);
        }
        return sum;
    }

    private double scanMarker(Category category, CompiledBlock block, CompiledPattern marker,
                              String text, List<MatchEvent> matches) {
        Matcher matcher = marker.matcher(DeadlineCharSequence.guard(text, marker.source(), matchTimeoutMillis));
        if (!matcher.find()) {
            return 0.0;
        }

        int offset = matcher.start();
        int occurrences = 1;
        if (scoringMode == ScoringMode.FREQUENCY) {
            while (matcher.find()) {
                occurrences++;
            }
        }

        double contribution = block.weight() * occurrences;
        matches.add(new MatchEvent(category, block.polarity(), marker.kind(), marker.source(),
                offset, occurrences, contribution));
        return contribution;
    }
}
