package com.sdmarker.infrastructure.transcript;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageTextNormalizerTest {

    private MessageTextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new MessageTextNormalizer();
    }

    @Test
    @DisplayName("null und leerer String")
    void null_und_leer() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }

    @Test
    @DisplayName("Zerlegte Umlaute werden zu NFC zusammengesetzt")
    void nfc_umlaute() {
        assertThat(normalizer.normalize("zugeho\u0308rigkeit")).isEqualTo("zugehörigkeit");
    }

    @Nested
    @DisplayName("Export-Artefakte")
    class ExportArtifactTests {

        @Test
        void unsichtbare_und_steuerzeichen_entfernt() {
            assertThat(normalizer.normalize("hilf\u200Blos\u0007")).isEqualTo("hilflos");
        }

        @Test
        @DisplayName("WhatsApp-Platzhalter samt Richtungszeichen")
        void whatsapp_platzhalter() {
            assertThat(normalizer.normalize("\u200E<Medien ausgeschlossen>")).isEmpty();
            assertThat(normalizer.normalize("schau mal <attached: 00000012-PHOTO.jpg> hier")).isEqualTo("schau mal hier");
            assertThat(normalizer.normalize("Diese Nachricht wurde gelöscht.")).isEmpty();
        }
    }

    @Test
    void typografische_zeichen_vereinheitlicht() {
        assertThat(normalizer.normalize("\u201EGut\u201C \u2013 sagt\u2019s"))
                .isEqualTo("\"Gut\" - sagt's");
    }

    @Test
    void leerraum_normalisiert() {
        assertThat(normalizer.normalize("  ich\t\t brauche\u00A0hilfe \r\n\r\n\r\n\r\n ok  "))
                .isEqualTo("ich brauche hilfe\n\nok");
    }
}
