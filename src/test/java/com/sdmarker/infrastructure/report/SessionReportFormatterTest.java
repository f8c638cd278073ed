package com.sdmarker.infrastructure.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sdmarker.application.analysis.SessionAnalysis;
import com.sdmarker.domain.marker.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionReportFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SessionReportFormatter formatter;
    private SessionAnalysis analysis;

    @BeforeEach
    void setUp() {
        formatter = new SessionReportFormatter(objectMapper);

        Map<Category, Double> first = new LinkedHashMap<>();
        first.put(Category.BEIGE, 1.0);
        first.put(Category.GRUEN, 0.0);
        Map<Category, Double> second = new LinkedHashMap<>();
        second.put(Category.BEIGE, 0.0);
        second.put(Category.GRUEN, 2.0);

        Map<Category, Double> means = new LinkedHashMap<>();
        means.put(Category.BEIGE, 0.5);
        means.put(Category.GRUEN, 1.0);
        Map<Category, Trend> trends = new LinkedHashMap<>();
        trends.put(Category.BEIGE, Trend.FALLING);
        trends.put(Category.GRUEN, Trend.RISING);

        DriftEvent drift = new DriftEvent(2, MarkerGroup.TRANSITION_MARKERS, "aber.*dann.*merkte.*ich", 0);
        LevelTransition transition = LevelTransition.of(2, Category.BEIGE, Category.GRUEN, 2.0);
        SessionProfile profile = new SessionProfile(means, Category.GRUEN, 2.0 / 3.0, trends, 2,
                List.of(drift), List.of(transition));

        MatchEvent hilflos = new MatchEvent(Category.BEIGE, Polarity.POSITIVE, MarkerKind.TOKEN, "hilflos", 7, 1, 1.0);
        MatchEvent gemeinsam = new MatchEvent(Category.GRUEN, Polarity.POSITIVE, MarkerKind.PATTERN,
                "gemeinsam.*schaffen", 22, 2, 2.0);

        analysis = new SessionAnalysis(
                List.of(new TranscriptEntry(1, "User", "ich bin hilflos", null),
                        new TranscriptEntry(2, "AI", "Aber dann merkte ich, wir schaffen das gemeinsam.", "10:15")),
                List.of(new ScoreResult(first, List.of(hilflos)), new ScoreResult(second, List.of(gemeinsam))),
                List.of(0, 4),
                profile);
    }

    @Nested
    @DisplayName("Textbericht")
    class TextReport {

        @Test
        void enthält_kopf_und_kategorien() {
            String report = formatter.toText(analysis);

            assertThat(report)
                    .contains("SPIRAL DYNAMICS MARKER REPORT")
                    .contains("Texteinheiten: 2")
                    .contains("Beige")
                    .contains("FALLING")
                    .contains("RISING")
                    .contains("Dominante Ebene: Gruen (Konfidenz 0.67)");
        }

        @Test
        @DisplayName("Sprecherstatistik und Top-Marker")
        void sprecher_und_top_marker() {
            String report = formatter.toText(analysis);

            assertThat(report)
                    .contains("  - User: 1 Nachrichten (50.0%)")
                    .contains("  - AI: 1 Nachrichten (50.0%)")
                    .contains("Gesamte Marker-Aktivität: 3")
                    .contains("Gruen/Positive \"gemeinsam.*schaffen\": 2 Treffer");
            assertThat(report.indexOf("gemeinsam.*schaffen\": 2")).isLessThan(report.indexOf("\"hilflos\": 1"));
        }

        @Test
        void ebenenwechsel_und_intensitaet() {
            String report = formatter.toText(analysis);

            assertThat(report)
                    .contains("Ebenenwechsel: 1")
                    .contains("#2 Beige→Gruen (2.0): Wertewandel von Beige zu Gruen")
                    .contains("Emotionale Intensität: Mittel 2.00")
                    .contains("#2 AI (4/5)")
                    .doesNotContain("#1 User (0/5)");
        }

        @Test
        void listet_drift_ereignisse_mit_sprecher() {
            String report = formatter.toText(analysis);

            assertThat(report)
                    .contains("Drift-Ereignisse: 1 (Transition 1, Widerstand 0)")
                    .contains("#2 [Transition_Markers] AI: \"Aber dann merkte ich")
                    .contains("Muster: aber.*dann.*merkte.*ich");
        }
    }

    @Test
    @DisplayName("Lange Texte werden auf 100 Zeichen gekürzt")
    void auszug_wird_gekürzt() {
        String text = "x".repeat(150);

        assertThat(SessionReportFormatter.excerpt(text)).hasSize(103).endsWith("...");
        assertThat(SessionReportFormatter.excerpt("zeile eins\nzeile zwei")).isEqualTo("zeile eins zeile zwei");
        assertThat(SessionReportFormatter.excerpt(null)).isEmpty();
    }

    @Test
    void json_bericht() throws Exception {
        JsonNode root = objectMapper.readTree(formatter.toJson(analysis));

        assertThat(root.path("profile").path("dominant").asText()).isEqualTo("GRUEN");
        assertThat(root.path("profile").path("textUnitCount").asInt()).isEqualTo(2);
        assertThat(root.path("profile").path("driftEvents").get(0).path("sequenceIndex").asInt()).isEqualTo(2);
        assertThat(root.path("entries")).hasSize(2);
        assertThat(root.path("scores").get(1).path("scores").path("GRUEN").asDouble()).isEqualTo(2.0);
        assertThat(root.path("intensities").get(1).asInt()).isEqualTo(4);
        assertThat(root.path("profile").path("levelTransitions").get(0).path("to").asText()).isEqualTo("GRUEN");
    }
}
