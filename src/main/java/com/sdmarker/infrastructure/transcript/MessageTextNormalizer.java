package com.sdmarker.infrastructure.transcript;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans one chat message before marker scanning.
 *
 * Composes decomposed umlauts (NFC) so tokens like "zugehörigkeit" match, drops export
 * artifacts (direction marks, media and deletion placeholders), folds typographic quotes
 * and dashes to ASCII and tidies whitespace.
 */
@Component
public class MessageTextNormalizer {

    private record Rule(Pattern pattern, String replacement) {
        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }

    private static final List<Rule> RULES = List.of(
            // zero-width, soft hyphen, BOM and the LRM/RLM marks WhatsApp puts around placeholders
            new Rule(Pattern.compile("[\\u200B-\\u200F\\uFEFF\\u00AD\\u2060\\u180E]"), ""),
            new Rule(Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"), ""),
            new Rule(Pattern.compile("\\r\\n?"), "\n"),
            new Rule(Pattern.compile(
                    "<(?:Medien ausgeschlossen|Media omitted|Anhang weggelassen|attached: [^>]*)>"
                            + "|Diese Nachricht wurde gelöscht\\.?|This message was deleted\\.?",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), ""),
            new Rule(Pattern.compile("[\\u201C\\u201D\\u201E\\u00AB\\u00BB]"), "\""),
            new Rule(Pattern.compile("[\\u2018\\u2019\\u201A\\u2039\\u203A]"), "'"),
            new Rule(Pattern.compile("[\\u2013\\u2014]"), "-"),
            new Rule(Pattern.compile("[ \\t\\u00A0]+"), " "),
            new Rule(Pattern.compile(" ?\\n ?"), "\n"),
            new Rule(Pattern.compile("\\n{3,}"), "\n\n")
    );

    /**
     * @return the cleaned message, or the input itself when null or empty
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        for (Rule rule : RULES) {
            result = rule.apply(result);
        }
        return result.strip();
    }
}
