package com.sdmarker.domain.marker.model;

/**
 * One text unit of a parsed chat transcript.
 *
 * @param line      1-based position in the transcript
 * @param speaker   normalized speaker name ("AI", "User", or title-cased)
 * @param text      message text
 * @param timestamp timestamp as it appears in the export (nullable)
 */
public record TranscriptEntry(
        int line,
        String speaker,
        String text,
        String timestamp
) {}
