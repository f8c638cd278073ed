package com.sdmarker.infrastructure.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sdmarker.application.analysis.MarkerHits;
import com.sdmarker.application.analysis.SessionAnalysis;
import com.sdmarker.domain.marker.model.Category;
import com.sdmarker.domain.marker.model.DriftEvent;
import com.sdmarker.domain.marker.model.LevelTransition;
import com.sdmarker.domain.marker.model.SessionProfile;
import com.sdmarker.domain.marker.model.TranscriptEntry;
import com.sdmarker.domain.marker.exception.MarkerEngineException;
import com.sdmarker.infrastructure.marker.scoring.EmotionalIntensityScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link SessionAnalysis} as a readable report or as JSON.
 */
@Component
@RequiredArgsConstructor
public class SessionReportFormatter {

    static final int EXCERPT_LENGTH = 100;
    static final int TOP_MARKER_LIMIT = 10;
    static final int HIGH_INTENSITY = 3;
    private static final String RULE = "=".repeat(72);
    private static final String SUB_RULE = "-".repeat(40);

    private final ObjectMapper objectMapper;

    public String toText(SessionAnalysis analysis) {
        SessionProfile profile = analysis.profile();
        StringBuilder sb = new StringBuilder();

        sb.append(RULE).append('\n');
        sb.append("SPIRAL DYNAMICS MARKER REPORT\n");
        sb.append(RULE).append('\n');
        sb.append("Texteinheiten: ").append(profile.textUnitCount()).append('\n');
        for (Map.Entry<String, Integer> speaker : analysis.speakerCounts().entrySet()) {
            sb.append(String.format(Locale.ROOT, "  - %s: %d Nachrichten (%.1f%%)%n",
                    speaker.getKey(), speaker.getValue(), 100.0 * speaker.getValue() / profile.textUnitCount()));
        }
        sb.append("Gesamte Marker-Aktivität: ").append(analysis.totalMarkerHits()).append('\n');
        sb.append('\n');

        sb.append("Kategorien (Mittelwert, Trend)\n");
        sb.append(SUB_RULE).append('\n');
        for (Map.Entry<Category, Double> entry : profile.aggregateScores().entrySet()) {
            sb.append(String.format(Locale.ROOT, "  %-10s %+8.3f  %s%n",
                    entry.getKey().configKey(), entry.getValue(), profile.trends().get(entry.getKey())));
        }
        sb.append('\n');

        sb.append(String.format(Locale.ROOT, "Dominante Ebene: %s (Konfidenz %.2f)%n",
                profile.dominant().configKey(), profile.confidence()));
        sb.append('\n');

        List<MarkerHits> topMarkers = analysis.topMarkers(TOP_MARKER_LIMIT);
        if (!topMarkers.isEmpty()) {
            sb.append("Top-Marker\n");
            sb.append(SUB_RULE).append('\n');
            for (MarkerHits marker : topMarkers) {
                sb.append(String.format(Locale.ROOT, "  %s/%s \"%s\": %d Treffer%n",
                        marker.category().configKey(), marker.polarity().configKey(), marker.marker(), marker.hits()));
            }
            sb.append('\n');
        }

        sb.append("Ebenenwechsel: ").append(profile.levelTransitions().size()).append('\n');
        sb.append(SUB_RULE).append('\n');
        for (LevelTransition transition : profile.levelTransitions()) {
            sb.append(String.format(Locale.ROOT, "  #%d %s (%.1f): %s%n",
                    transition.sequenceIndex(), transition.label(), transition.score(), transition.meaning()));
        }
        sb.append('\n');

        sb.append(String.format(Locale.ROOT, "Emotionale Intensität: Mittel %.2f%n",
                analysis.intensities().stream().mapToInt(Integer::intValue).average().orElse(0.0)));
        for (TranscriptEntry entry : analysis.entries()) {
            int intensity = analysis.intensity(entry.line());
            if (intensity >= HIGH_INTENSITY) {
                sb.append(String.format(Locale.ROOT, "  #%d %s (%d/%d): \"%s\"%n", entry.line(), entry.speaker(),
                        intensity, EmotionalIntensityScorer.MAX_INTENSITY, excerpt(entry.text())));
            }
        }
        sb.append('\n');

        sb.append("Drift-Ereignisse: ").append(profile.driftEvents().size())
                .append(" (Transition ").append(profile.transitionCount())
                .append(", Widerstand ").append(profile.resistanceCount()).append(")\n");
        sb.append(SUB_RULE).append('\n');
        for (DriftEvent event : profile.driftEvents()) {
            TranscriptEntry entry = analysis.entry(event.sequenceIndex());
            sb.append(String.format(Locale.ROOT, "  #%d [%s] %s: \"%s\"%n",
                    event.sequenceIndex(), event.groupName(), entry.speaker(), excerpt(entry.text())));
            sb.append("      Muster: ").append(event.pattern()).append('\n');
        }

        return sb.toString();
    }

    public String toJson(SessionAnalysis analysis) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new MarkerEngineException("Failed to serialize session analysis", e);
        }
    }

    static String excerpt(String text) {
        if (text == null) {
            return "";
        }
        String singleLine = text.replace('\n', ' ');
        return singleLine.length() > EXCERPT_LENGTH ? singleLine.substring(0, EXCERPT_LENGTH) + "..." : singleLine;
    }
}
