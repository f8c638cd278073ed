package com.sdmarker.domain.marker.model;

import java.util.Map;

/**
 * Change of the dominant value stage between text units.
 *
 * @param sequenceIndex 1-based index of the unit where the new stage takes over
 * @param from          stage of the last unit that had one
 * @param to            stage of this unit
 * @param score         score of {@code to} in this unit
 * @param meaning       developmental reading of the step
 */
public record LevelTransition(
        int sequenceIndex,
        Category from,
        Category to,
        double score,
        String meaning
) {
    private static final Map<String, String> MEANINGS = Map.of(
            key(Category.BEIGE, Category.PURPUR), "Entwicklung von Überlebensmodus zu sozialer Bindung",
            key(Category.PURPUR, Category.ROT), "Von Gruppenloyalität zu individueller Macht",
            key(Category.ROT, Category.BLAU), "Von Chaos zu Ordnung und Struktur",
            key(Category.BLAU, Category.ORANGE), "Von starren Regeln zu strategischem Denken",
            key(Category.ORANGE, Category.GRUEN), "Von Leistung zu zwischenmenschlicher Harmonie",
            key(Category.GRUEN, Category.GELB), "Von emotionaler zu systemischer Betrachtung",
            key(Category.GELB, Category.TUERKIS), "Von analytischem zu holistischem Bewusstsein",
            key(Category.TUERKIS, Category.KORALLE), "Von holistischem Bewusstsein zu universeller Einheit"
    );

    public static LevelTransition of(int sequenceIndex, Category from, Category to, double score) {
        String meaning = MEANINGS.getOrDefault(key(from, to),
                "Wertewandel von " + from.configKey() + " zu " + to.configKey());
        return new LevelTransition(sequenceIndex, from, to, score, meaning);
    }

    /**
     * "Beige→Purpur" style label.
     */
    public String label() {
        return from.configKey() + "→" + to.configKey();
    }

    /**
     * True when the step goes up the spiral (enum order).
     */
    public boolean isProgression() {
        return to.ordinal() > from.ordinal();
    }

    private static String key(Category from, Category to) {
        return from.name() + ">" + to.name();
    }
}
