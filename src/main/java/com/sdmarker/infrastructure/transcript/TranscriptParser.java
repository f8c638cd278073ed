package com.sdmarker.infrastructure.transcript;

import com.sdmarker.domain.marker.model.TranscriptEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a plain-text chat export into ordered text units.
 *
 * Formats are tried in order, the first that recognizes the content wins:
 *   1. WhatsApp export   "[12.03.24, 14:05:33] Anna: text"
 *   2. Discord-like log  "14:05 Anna text"
 *   3. Colon format      "Anna: text"
 *   4. Markdown          "**Anna**" or "## Anna" heading followed by text lines
 *   5. Fallback          every non-blank line is one unit of speaker "Unknown"
 *
 * In the line-oriented formats (1-3) a line without a message header continues the previous
 * message. They must recognize more than 30% of the non-blank lines.
 * Entry numbering is 1-based and follows the order of the returned list.
 */
@Slf4j
@Component
public class TranscriptParser {

    public static final String UNKNOWN_SPEAKER = "Unknown";

    private static final double MIN_RECOGNIZED_RATIO = 0.3;
    private static final int MAX_SPEAKER_LENGTH = 40;

    private static final Pattern WHATSAPP_LINE = Pattern.compile(
            "^\\[(\\d{1,2}\\.\\d{1,2}\\.\\d{2,4},\\s\\d{1,2}:\\d{2}(?::\\d{2})?)]\\s([^:]+?):\\s(.+)$");
    private static final Pattern DISCORD_LINE = Pattern.compile("^(\\d{1,2}:\\d{2})\\s+(\\S+)\\s+(.+)$");
    private static final Pattern COLON_LINE = Pattern.compile("^([^:]{1,40}):\\s*(.+)$");
    private static final Pattern MARKDOWN_BOLD_SPEAKER = Pattern.compile("^\\*\\*([^*]+)\\*\\*:?$");
    private static final Pattern MARKDOWN_HEADING_SPEAKER = Pattern.compile("^#{1,6}\\s*(.+)$");

    private static final Map<String, String> SPEAKER_ALIASES = Map.ofEntries(
            Map.entry("chatgpt", "AI"), Map.entry("gpt", "AI"), Map.entry("claude", "AI"),
            Map.entry("bot", "AI"), Map.entry("assistant", "AI"), Map.entry("ki", "AI"), Map.entry("ai", "AI"),
            Map.entry("ich", "User"), Map.entry("user", "User"), Map.entry("human", "User"),
            Map.entry("you", "User"), Map.entry("du", "User"), Map.entry("nutzer", "User")
    );

    private record RawEntry(String speaker, String text, String timestamp) {}

    public List<TranscriptEntry> parse(String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<String> lines = content.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();

        List<Function<List<String>, List<RawEntry>>> parsers = List.of(
                this::parseWhatsApp,
                this::parseDiscord,
                this::parseColon,
                this::parseMarkdown
        );
        for (Function<List<String>, List<RawEntry>> parser : parsers) {
            List<RawEntry> parsed = parser.apply(lines);
            if (!parsed.isEmpty()) {
                return number(parsed);
            }
        }

        log.debug("[TranscriptParser] No chat format recognized, treating {} lines as units", lines.size());
        return number(lines.stream().map(l -> new RawEntry(UNKNOWN_SPEAKER, l, null)).toList());
    }

    private List<RawEntry> parseWhatsApp(List<String> lines) {
        return parseTimestamped(lines, WHATSAPP_LINE, "WhatsApp");
    }

    private List<RawEntry> parseDiscord(List<String> lines) {
        return parseTimestamped(lines, DISCORD_LINE, "Discord");
    }

    // Groups: 1 = timestamp, 2 = speaker, 3 = text. Unmatched lines continue the previous message.
    private List<RawEntry> parseTimestamped(List<String> lines, Pattern linePattern, String format) {
        List<RawEntry> parsed = new ArrayList<>();
        int recognizedLines = 0;
        for (String line : lines) {
            Matcher m = linePattern.matcher(line);
            if (m.matches()) {
                recognizedLines++;
                parsed.add(new RawEntry(normalizeSpeaker(m.group(2)), m.group(3).strip(), m.group(1)));
            } else if (!parsed.isEmpty()) {
                parsed.add(continued(parsed.remove(parsed.size() - 1), line));
            }
        }
        return recognized(recognizedLines, lines.size(), format) ? parsed : List.of();
    }

    private List<RawEntry> parseColon(List<String> lines) {
        List<RawEntry> parsed = new ArrayList<>();
        int recognizedLines = 0;
        for (String line : lines) {
            Matcher m = COLON_LINE.matcher(line);
            if (m.matches() && !line.startsWith("http") && m.group(1).strip().length() <= MAX_SPEAKER_LENGTH) {
                recognizedLines++;
                parsed.add(new RawEntry(normalizeSpeaker(m.group(1)), m.group(2).strip(), null));
            } else if (!parsed.isEmpty()) {
                parsed.add(continued(parsed.remove(parsed.size() - 1), line));
            }
        }
        return recognized(recognizedLines, lines.size(), "colon") ? parsed : List.of();
    }

    private List<RawEntry> parseMarkdown(List<String> lines) {
        List<RawEntry> parsed = new ArrayList<>();
        String currentSpeaker = UNKNOWN_SPEAKER;
        boolean sawHeading = false;
        for (String line : lines) {
            Matcher bold = MARKDOWN_BOLD_SPEAKER.matcher(line);
            Matcher heading = MARKDOWN_HEADING_SPEAKER.matcher(line);
            if (bold.matches()) {
                currentSpeaker = normalizeSpeaker(bold.group(1));
                sawHeading = true;
            } else if (heading.matches()) {
                currentSpeaker = normalizeSpeaker(heading.group(1));
                sawHeading = true;
            } else {
                parsed.add(new RawEntry(currentSpeaker, line, null));
            }
        }
        if (sawHeading && !parsed.isEmpty()) {
            log.debug("[TranscriptParser] Recognized Markdown format ({} units)", parsed.size());
            return parsed;
        }
        return List.of();
    }

    private static RawEntry continued(RawEntry previous, String line) {
        return new RawEntry(previous.speaker(), previous.text() + "\n" + line, previous.timestamp());
    }

    private boolean recognized(int recognizedLines, int totalLines, String format) {
        boolean ok = recognizedLines > 0 && recognizedLines > totalLines * MIN_RECOGNIZED_RATIO;
        if (ok) {
            log.debug("[TranscriptParser] Recognized {} format ({}/{} lines)", format, recognizedLines, totalLines);
        }
        return ok;
    }

    private static List<TranscriptEntry> number(List<RawEntry> raw) {
        List<TranscriptEntry> entries = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            RawEntry r = raw.get(i);
            entries.add(new TranscriptEntry(i + 1, r.speaker(), r.text(), r.timestamp()));
        }
        return entries;
    }

    /**
     * Map known assistant/user aliases to "AI"/"User"; title-case anything else.
     */
    static String normalizeSpeaker(String speaker) {
        String key = speaker.strip().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return UNKNOWN_SPEAKER;
        }
        String alias = SPEAKER_ALIASES.get(key);
        if (alias != null) {
            return alias;
        }
        StringBuilder sb = new StringBuilder(key.length());
        boolean startOfWord = true;
        for (char c : key.toCharArray()) {
            sb.append(startOfWord ? Character.toUpperCase(c) : c);
            startOfWord = !Character.isLetterOrDigit(c);
        }
        return sb.toString();
    }
}
