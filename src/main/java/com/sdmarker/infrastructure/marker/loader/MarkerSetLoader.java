package com.sdmarker.infrastructure.marker.loader;

import com.sdmarker.domain.marker.exception.MarkerConfigException;
import com.sdmarker.domain.marker.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns the raw nested marker configuration (maps of maps of lists) into a typed {@link MarkerSet}.
 *
 * The taxonomy is read from the "Spiral_Dynamics_Enhanced" section when present, otherwise from
 * every top-level key except "Semantic_Drift". The raw map is only read, never modified.
 * Trailing "# comment" text is stripped from pattern strings here so compiled patterns never
 * see comment syntax.
 */
@Slf4j
@Component
public class MarkerSetLoader {

    public static final String TAXONOMY_SECTION = "Spiral_Dynamics_Enhanced";
    public static final String DRIFT_SECTION = "Semantic_Drift";

    private static final String WEIGHT_KEY = "weight";
    private static final String TOKENS_KEY = "tokens";
    private static final String PATTERNS_KEY = "patterns";

    public MarkerSet load(Map<String, ?> rawConfig) {
        if (rawConfig == null || rawConfig.isEmpty()) {
            throw new MarkerConfigException("Marker configuration is empty");
        }

        Map<String, ?> taxonomy = taxonomySection(rawConfig);
        List<CategoryMarkers> categories = new ArrayList<>();
        Set<Category> seen = EnumSet.noneOf(Category.class);

        for (Map.Entry<String, ?> entry : taxonomy.entrySet()) {
            Category category = Category.fromConfigKey(entry.getKey())
                    .orElseThrow(() -> new MarkerConfigException("Unknown category: " + entry.getKey()));
            if (!seen.add(category)) {
                throw new MarkerConfigException("Category declared twice: " + entry.getKey());
            }
            Map<String, ?> blocks = asMap(entry.getValue(), category.configKey());
            categories.add(new CategoryMarkers(
                    category,
                    loadBlock(category, Polarity.POSITIVE, blocks),
                    loadBlock(category, Polarity.NEGATIVE, blocks)));
        }

        if (categories.isEmpty()) {
            throw new MarkerConfigException("Marker configuration declares no categories");
        }

        List<MarkerGroup> groups = loadGroups(rawConfig.get(DRIFT_SECTION));

        MarkerSet markerSet = new MarkerSet(categories, groups);
        log.info("[MarkerSetLoader] Loaded {} categories ({} markers), {} drift groups",
                categories.size(),
                categories.stream().mapToInt(c -> c.positive().markerCount() + c.negative().markerCount()).sum(),
                groups.size());
        return markerSet;
    }

    private Map<String, ?> taxonomySection(Map<String, ?> rawConfig) {
        if (rawConfig.containsKey(TAXONOMY_SECTION)) {
            return asMap(rawConfig.get(TAXONOMY_SECTION), TAXONOMY_SECTION);
        }
        Map<String, Object> taxonomy = new LinkedHashMap<>();
        rawConfig.forEach((key, value) -> {
            if (!DRIFT_SECTION.equals(key)) {
                taxonomy.put(key, value);
            }
        });
        return taxonomy;
    }

    private PolarityBlock loadBlock(Category category, Polarity polarity, Map<String, ?> blocks) {
        String path = category.configKey() + "." + polarity.configKey();
        Object rawBlock = blocks.get(polarity.configKey());
        if (rawBlock == null) {
            throw new MarkerConfigException("Missing " + polarity.configKey() + " block for category " + category.configKey());
        }
        Map<String, ?> block = asMap(rawBlock, path);

        Object weight = block.get(WEIGHT_KEY);
        if (!(weight instanceof Number number)) {
            throw new MarkerConfigException("Weight of " + path + " must be numeric, got: " + weight);
        }

        List<String> tokens = new ArrayList<>();
        Set<String> seenTokens = new HashSet<>();
        for (String token : asStringList(block.get(TOKENS_KEY), path + "." + TOKENS_KEY)) {
            String normalized = token.strip().toLowerCase(Locale.ROOT);
            if (normalized.isEmpty()) {
                throw new MarkerConfigException("Blank token in " + path);
            }
            if (!seenTokens.add(normalized)) {
                log.warn("[MarkerSetLoader] Duplicate token '{}' in {} ignored", normalized, path);
                continue;
            }
            tokens.add(normalized);
        }

        List<String> patterns = new ArrayList<>();
        for (String rawPattern : asStringList(block.get(PATTERNS_KEY), path + "." + PATTERNS_KEY)) {
            String pattern = stripTrailingComment(rawPattern);
            if (pattern.isEmpty()) {
                throw new MarkerConfigException("Blank pattern in " + path + ": \"" + rawPattern + "\"");
            }
            if (patterns.contains(pattern)) {
                log.warn("[MarkerSetLoader] Duplicate pattern '{}' in {} ignored", pattern, path);
                continue;
            }
            patterns.add(pattern);
        }

        return new PolarityBlock(category, polarity, number.doubleValue(), tokens, patterns);
    }

    private List<MarkerGroup> loadGroups(Object rawDrift) {
        if (rawDrift == null) {
            return List.of();
        }
        List<MarkerGroup> groups = new ArrayList<>();
        for (Map.Entry<String, ?> entry : asMap(rawDrift, DRIFT_SECTION).entrySet()) {
            String path = DRIFT_SECTION + "." + entry.getKey();
            if (!(entry.getValue() instanceof List<?> entries)) {
                throw new MarkerConfigException(path + " must be a list of {patterns: [...]} entries");
            }
            List<String> patterns = new ArrayList<>();
            for (Object rawEntry : entries) {
                Map<String, ?> patternEntry = asMap(rawEntry, path);
                for (String rawPattern : asStringList(patternEntry.get(PATTERNS_KEY), path + "." + PATTERNS_KEY)) {
                    String pattern = stripTrailingComment(rawPattern);
                    if (pattern.isEmpty()) {
                        throw new MarkerConfigException("Blank pattern in " + path + ": \"" + rawPattern + "\"");
                    }
                    patterns.add(pattern);
                }
            }
            groups.add(new MarkerGroup(entry.getKey(), patterns));
        }
        return groups;
    }

    /**
     * Removes a trailing human comment: an unescaped '#' at the start or after whitespace,
     * and everything following it. A '#' directly after a regex character is kept.
     */
    static String stripTrailingComment(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) != '#') {
                continue;
            }
            if (i == 0 || (Character.isWhitespace(pattern.charAt(i - 1)) && !isEscaped(pattern, i - 1))) {
                return pattern.substring(0, i).strip();
            }
        }
        return pattern.strip();
    }

    private static boolean isEscaped(String s, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    private static Map<String, Object> asMap(Object value, String path) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new MarkerConfigException(path + " must be a mapping, got: " + typeName(value));
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new MarkerConfigException(path + " has a non-string key: " + entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    private static List<String> asStringList(Object value, String path) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new MarkerConfigException(path + " must be a list of strings, got: " + typeName(value));
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String s)) {
                throw new MarkerConfigException(path + " must contain only strings, got: " + typeName(item));
            }
            result.add(s);
        }
        return result;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
