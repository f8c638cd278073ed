package com.sdmarker.application.analysis;

import com.sdmarker.domain.marker.exception.AnalysisCancelledException;
import com.sdmarker.domain.marker.exception.EmptyTranscriptException;
import com.sdmarker.domain.marker.exception.MarkerMatchTimeoutException;
import com.sdmarker.domain.marker.model.*;
import com.sdmarker.infrastructure.marker.MarkerFixtures;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerGroups;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerSet;
import com.sdmarker.infrastructure.marker.compile.PatternCompiler;
import com.sdmarker.infrastructure.marker.loader.MarkerSetLoader;
import com.sdmarker.infrastructure.transcript.MessageTextNormalizer;
import com.sdmarker.infrastructure.marker.scoring.DriftDetector;
import com.sdmarker.infrastructure.marker.scoring.EmotionalIntensityScorer;
import com.sdmarker.infrastructure.marker.scoring.SessionAggregator;
import com.sdmarker.infrastructure.marker.scoring.TextScorer;
import com.sdmarker.infrastructure.transcript.TranscriptParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static com.sdmarker.infrastructure.marker.MarkerFixtures.block;
import static com.sdmarker.infrastructure.marker.MarkerFixtures.category;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SessionAnalysisServiceTest {

    private ExecutorService executor;
    private SessionAnalysisService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        MarkerSet markerSet = MarkerFixtures.bundledMarkerSet();
        PatternCompiler compiler = new PatternCompiler();
        service = service(new TextScorer(), compiler.compile(markerSet), compiler.compileGroups(markerSet));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private SessionAnalysisService service(TextScorer scorer, CompiledMarkerSet markers, CompiledMarkerGroups groups) {
        return service(scorer, markers, groups, executor);
    }

    private SessionAnalysisService service(TextScorer scorer, CompiledMarkerSet markers, CompiledMarkerGroups groups,
                                           Executor pool) {
        return new SessionAnalysisService(new TranscriptParser(), new MessageTextNormalizer(), scorer,
                new DriftDetector(), new EmotionalIntensityScorer(), new SessionAggregator(), markers, groups, pool);
    }

    private static CompiledMarkerSet hangingMarkers() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("Gelb", category(block(1.0, List.of(), List.of("a*a*a*a*a*a*b")), block(-0.8, List.of(), List.of())));
        return new PatternCompiler().compile(new MarkerSetLoader().load(raw));
    }

    private static String resource(String name) throws IOException {
        try (InputStream is = SessionAnalysisServiceTest.class.getResourceAsStream(name)) {
            assertThat(is).as(name).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("WhatsApp-Transkript: Profil, Trend und Drift")
    void whatsapp_transkript() throws IOException {
        SessionAnalysis analysis = service.analyzeTranscript(resource("/transcripts/whatsapp_chat.txt"));
        SessionProfile profile = analysis.profile();

        assertThat(analysis.entries()).hasSize(4);
        assertThat(analysis.scores()).hasSize(4);
        assertThat(analysis.scores().get(0).score(Category.BEIGE)).isEqualTo(2.0);
        assertThat(profile.dominant()).isEqualTo(Category.GRUEN);
        assertThat(profile.trends())
                .containsEntry(Category.BEIGE, Trend.FALLING)
                .containsEntry(Category.GRUEN, Trend.RISING);
        assertThat(profile.driftEvents()).singleElement().satisfies(event -> {
            assertThat(event.sequenceIndex()).isEqualTo(3);
            assertThat(event.isTransition()).isTrue();
        });
        assertThat(analysis.entry(3).speaker()).isEqualTo("Anna");
        assertThat(profile.levelTransitions()).singleElement().satisfies(transition -> {
            assertThat(transition.sequenceIndex()).isEqualTo(4);
            assertThat(transition.label()).isEqualTo("Purpur→Gruen");
        });
        assertThat(analysis.intensities()).containsExactly(0, 0, 0, 0);
        assertThat(analysis.speakerCounts()).containsExactly(entry("Anna", 3), entry("AI", 1));
    }

    @Test
    void emotionale_intensitaet_pro_einheit() {
        SessionAnalysis analysis = service.analyze(List.of("Das ist TOTAL unfair!!", "ok"));

        assertThat(analysis.intensity(1)).isEqualTo(4);
        assertThat(analysis.intensity(2)).isZero();
    }

    @Test
    @DisplayName("Parallele Verarbeitung erhält die Transkriptreihenfolge")
    void reihenfolge_bleibt_erhalten() {
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            texts.add(i % 3 == 0 ? "ich bin hilflos" : "ein ganz neutraler Satz Nummer " + i);
        }

        SessionAnalysis analysis = service.analyze(texts);

        for (int i = 0; i < texts.size(); i++) {
            double expected = i % 3 == 0 ? 1.0 : 0.0;
            assertThat(analysis.scores().get(i).score(Category.BEIGE)).as("unit %d", i + 1).isEqualTo(expected);
        }
        assertThat(analysis.profile().textUnitCount()).isEqualTo(60);
    }

    @Test
    void leeres_transkript() {
        assertThatThrownBy(() -> service.analyze(List.of())).isInstanceOf(EmptyTranscriptException.class);
        assertThatThrownBy(() -> service.analyzeTranscript("  ")).isInstanceOf(EmptyTranscriptException.class);
    }

    @Test
    @DisplayName("Fehler einer Einheit bricht die gesamte Analyse ab")
    void fehler_einer_einheit_propagiert() {
        SessionAnalysisService guarded = service(
                new TextScorer(ScoringMode.PRESENCE, 30), hangingMarkers(), CompiledMarkerGroups.empty());

        assertThatThrownBy(() -> guarded.analyze(List.of("harmlos", "a".repeat(3000))))
                .isInstanceOf(MarkerMatchTimeoutException.class);
    }

    @Test
    @DisplayName("Nach einem Fehler werden wartende Einheiten nicht mehr gescannt")
    void wartende_einheiten_werden_abgebrochen() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            TextScorer scorer = spy(new TextScorer(ScoringMode.PRESENCE, 30));
            SessionAnalysisService guarded = service(scorer, hangingMarkers(), CompiledMarkerGroups.empty(), single);

            assertThatThrownBy(() -> guarded.analyze(List.of("a".repeat(3000), "eins", "zwei", "drei")))
                    .isInstanceOf(MarkerMatchTimeoutException.class);
            verify(scorer, times(1)).score(anyString(), any());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    @DisplayName("Abbruch meldet die tatsächlich verarbeiteten Einheiten")
    void abbruch_zaehlt_verarbeitete_einheiten() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            MarkerSet markerSet = MarkerFixtures.bundledMarkerSet();
            PatternCompiler compiler = new PatternCompiler();
            SessionAnalysisService sequential = service(new TextScorer(),
                    compiler.compile(markerSet), compiler.compileGroups(markerSet), single);
            AtomicInteger checks = new AtomicInteger();
            List<TranscriptEntry> entries = List.of(
                    new TranscriptEntry(1, "User", "hilflos", null),
                    new TranscriptEntry(2, "AI", "was fehlt dir?", null),
                    new TranscriptEntry(3, "User", "ordnung", null));

            assertThatThrownBy(() -> sequential.analyzeEntries(entries, () -> checks.incrementAndGet() > 2))
                    .isInstanceOf(AnalysisCancelledException.class)
                    .hasMessageContaining("after 2 of 3");
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void abbruch_vor_der_verarbeitung() {
        List<TranscriptEntry> entries = List.of(new TranscriptEntry(1, "User", "hilflos", null));

        assertThatThrownBy(() -> service.analyzeEntries(entries, () -> true))
                .isInstanceOf(AnalysisCancelledException.class);
    }
}
