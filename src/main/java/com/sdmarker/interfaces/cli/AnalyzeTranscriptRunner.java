package com.sdmarker.interfaces.cli;

import com.sdmarker.application.analysis.SessionAnalysis;
import com.sdmarker.application.analysis.SessionAnalysisService;
import com.sdmarker.infrastructure.report.SessionReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point.
 *
 *   java -jar sd-marker-engine.jar --transcript=chat.txt [--format=text|json]
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyzeTranscriptRunner implements ApplicationRunner {

    static final String TRANSCRIPT_OPTION = "transcript";
    static final String FORMAT_OPTION = "format";

    private final SessionAnalysisService sessionAnalysisService;
    private final SessionReportFormatter reportFormatter;

    private PrintStream out = System.out;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> transcripts = args.getOptionValues(TRANSCRIPT_OPTION);
        if (transcripts == null || transcripts.isEmpty()) {
            log.info("[CLI] No --{}=<file> given, nothing to analyze", TRANSCRIPT_OPTION);
            return;
        }

        String format = firstOrDefault(args.getOptionValues(FORMAT_OPTION), "text");
        if (!format.equals("text") && !format.equals("json")) {
            throw new IllegalArgumentException("Unsupported --format: " + format + " (expected text or json)");
        }

        for (String transcript : transcripts) {
            Path path = Path.of(transcript);
            log.info("[CLI] Analyzing {}", path);
            String content = Files.readString(path, StandardCharsets.UTF_8);
            SessionAnalysis analysis = sessionAnalysisService.analyzeTranscript(content);
            out.println(format.equals("json") ? reportFormatter.toJson(analysis) : reportFormatter.toText(analysis));
        }
    }

    private static String firstOrDefault(List<String> values, String fallback) {
        return values == null || values.isEmpty() ? fallback : values.get(0).strip().toLowerCase();
    }
}
