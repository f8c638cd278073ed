package com.sdmarker.infrastructure.marker.scoring;

import com.sdmarker.domain.marker.model.DriftEvent;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerGroup;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerGroups;
import com.sdmarker.infrastructure.marker.compile.CompiledPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Scans a transcript for transition and resistance markers.
 *
 * Events are ordered by transcript position, then group declaration order, then pattern
 * declaration order. Sequence indices are 1-based. Hits are never deduplicated across units.
 */
@Slf4j
@Component
public class DriftDetector {

    private final long matchTimeoutMillis;

    @Autowired
    public DriftDetector(@Value("${markers.match-timeout-ms:250}") long matchTimeoutMillis) {
        this.matchTimeoutMillis = matchTimeoutMillis;
    }

    public DriftDetector() {
        this(250);
    }

    public List<DriftEvent> detect(List<String> texts, CompiledMarkerGroups groups) {
        List<DriftEvent> events = new ArrayList<>();
        for (int i = 0; i < texts.size(); i++) {
            events.addAll(detectUnit(i + 1, texts.get(i), groups));
        }
        if (!events.isEmpty()) {
            log.info("[DriftDetector] {} drift events in {} text units", events.size(), texts.size());
        }
        return events;
    }

    /**
     * Scan a single text unit.
     *
     * @param sequenceIndex 1-based position of the unit in its transcript
     */
    public List<DriftEvent> detectUnit(int sequenceIndex, String text, CompiledMarkerGroups groups) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<DriftEvent> events = new ArrayList<>();
        for (CompiledMarkerGroup group : groups.groups()) {
            for (CompiledPattern pattern : group.patterns()) {
                Matcher matcher = pattern.matcher(DeadlineCharSequence.guard(text, pattern.source(), matchTimeoutMillis));
                if (matcher.find()) {
                    events.add(new DriftEvent(sequenceIndex, group.name(), pattern.source(), matcher.start()));
                }
            }
        }
        return events;
    }
}
