package com.sdmarker.infrastructure.marker.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmotionalIntensityScorerTest {

    private final EmotionalIntensityScorer scorer = new EmotionalIntensityScorer();

    @Test
    void ruhiger_text() {
        assertThat(scorer.score("Wir sollten darüber reden.")).isZero();
        assertThat(scorer.score(null)).isZero();
        assertThat(scorer.score("")).isZero();
    }

    @Test
    @DisplayName("Ausrufezeichen, Großschreibung, Dehnung und Verstärker zählen je einen Punkt")
    void einzelne_signale() {
        assertThat(scorer.score("Hör auf!")).isEqualTo(1);
        assertThat(scorer.score("Das ist NICHT ok")).isEqualTo(1);
        assertThat(scorer.score("neeein")).isEqualTo(1);
        assertThat(scorer.score("das war sehr sehr schwer")).isEqualTo(1);
    }

    @Test
    @DisplayName("Kurze Großschreibung und Wortteile zählen nicht")
    void keine_fehlalarme() {
        assertThat(scorer.score("Die KI und ich")).isZero();
        assertThat(scorer.score("totalitär und sehnsüchtig")).isZero();
    }

    @Test
    void hoechstens_fuenf() {
        assertThat(scorer.score("NEIN!!! Das ist TOTAL unglaublich schlimm, aaaah!!")).isEqualTo(EmotionalIntensityScorer.MAX_INTENSITY);
    }
}
