package com.sdmarker.domain.marker.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Spiral Dynamics value stages known to the taxonomy.
 * Tie-breaking uses the order in which a loaded marker set declares them, not this enum order.
 */
public enum Category {
    BEIGE("Beige"),
    PURPUR("Purpur"),
    ROT("Rot"),
    BLAU("Blau"),
    ORANGE("Orange"),
    GRUEN("Gruen", "Grün"),
    GELB("Gelb"),
    TUERKIS("Tuerkis", "Türkis"),
    KORALLE("Koralle");

    private final String configKey;
    private final Set<String> aliases;

    Category(String configKey, String... aliases) {
        this.configKey = configKey;
        this.aliases = Set.of(aliases);
    }

    public String configKey() {
        return configKey;
    }

    /**
     * Resolve a config key (case-insensitive, umlaut aliases accepted).
     */
    public static Optional<Category> fromConfigKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.strip().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.configKey.toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(category);
            }
            for (String alias : category.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }
}
