package com.sdmarker.application.analysis;

import com.sdmarker.domain.marker.model.MatchEvent;
import com.sdmarker.domain.marker.model.ScoreResult;
import com.sdmarker.domain.marker.model.SessionProfile;
import com.sdmarker.domain.marker.model.TranscriptEntry;

import java.util.*;

/**
 * Result of analyzing one transcript.
 *
 * @param entries     text units in transcript order
 * @param scores      per-unit scores, index-aligned with {@code entries}
 * @param intensities per-unit emotional intensity (0 to 5), index-aligned with {@code entries}
 * @param profile     session aggregate
 */
public record SessionAnalysis(
        List<TranscriptEntry> entries,
        List<ScoreResult> scores,
        List<Integer> intensities,
        SessionProfile profile
) {
    public SessionAnalysis {
        entries = List.copyOf(entries);
        scores = List.copyOf(scores);
        intensities = List.copyOf(intensities);
        if (scores.size() != entries.size() || intensities.size() != entries.size()) {
            throw new IllegalArgumentException("Per-unit results must align with " + entries.size() + " entries");
        }
    }

    public TranscriptEntry entry(int sequenceIndex) {
        return entries.get(position(sequenceIndex));
    }

    public int intensity(int sequenceIndex) {
        return intensities.get(position(sequenceIndex));
    }

    /**
     * Messages per speaker, most active first; ties keep first appearance order.
     */
    public Map<String, Integer> speakerCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (TranscriptEntry entry : entries) {
            counts.merge(entry.speaker(), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
        sorted.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        Map<String, Integer> result = new LinkedHashMap<>();
        sorted.forEach(e -> result.put(e.getKey(), e.getValue()));
        return result;
    }

    /**
     * Markers with the most occurrences over all units. Ties keep the order of first appearance.
     */
    public List<MarkerHits> topMarkers(int limit) {
        Map<String, MarkerHits> byMarker = new LinkedHashMap<>();
        for (ScoreResult score : scores) {
            for (MatchEvent match : score.matches()) {
                String key = match.category() + "/" + match.polarity() + "/" + match.marker();
                MarkerHits previous = byMarker.get(key);
                int hits = match.occurrences() + (previous == null ? 0 : previous.hits());
                byMarker.put(key, new MarkerHits(match.category(), match.polarity(), match.marker(), hits));
            }
        }
        return byMarker.values().stream()
                .sorted(Comparator.comparingInt(MarkerHits::hits).reversed())
                .limit(limit)
                .toList();
    }

    public int totalMarkerHits() {
        return scores.stream()
                .flatMap(s -> s.matches().stream())
                .mapToInt(MatchEvent::occurrences)
                .sum();
    }

    private int position(int sequenceIndex) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).line() == sequenceIndex) {
                return i;
            }
        }
        throw new IllegalArgumentException("No text unit with index " + sequenceIndex);
    }
}
