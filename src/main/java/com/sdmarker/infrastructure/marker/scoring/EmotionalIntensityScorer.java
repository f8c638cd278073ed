package com.sdmarker.infrastructure.marker.scoring;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rates how emotionally charged a text unit reads from its surface features, 0 to 5.
 *
 * One point each per exclamation mark, shouted word (all caps, at least three letters),
 * stretched character run ("neeein") and distinct intensifier word.
 */
@Component
public class EmotionalIntensityScorer {

    public static final int MAX_INTENSITY = 5;

    private static final Pattern SHOUTED_WORD = Pattern.compile("(?<![\\p{L}\\p{N}])\\p{Lu}{3,}(?![\\p{L}\\p{N}])");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{2,}");
    private static final List<Pattern> INTENSIFIERS = List.of("sehr", "extrem", "wahnsinnig", "unglaublich", "total", "komplett")
            .stream()
            .map(word -> Pattern.compile("(?<![\\p{L}\\p{N}])" + word + "(?![\\p{L}\\p{N}])"))
            .toList();

    public int score(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int points = (int) text.chars().filter(c -> c == '!').count();
        points += count(SHOUTED_WORD.matcher(text));
        points += count(REPEATED_CHAR.matcher(text));

        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern intensifier : INTENSIFIERS) {
            if (intensifier.matcher(lower).find()) {
                points++;
            }
        }
        return Math.min(points, MAX_INTENSITY);
    }

    private static int count(Matcher matcher) {
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
