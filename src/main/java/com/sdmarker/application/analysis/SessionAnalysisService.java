package com.sdmarker.application.analysis;

import com.sdmarker.domain.marker.exception.AnalysisCancelledException;
import com.sdmarker.domain.marker.exception.EmptyTranscriptException;
import com.sdmarker.domain.marker.model.DriftEvent;
import com.sdmarker.domain.marker.model.ScoreResult;
import com.sdmarker.domain.marker.model.SessionProfile;
import com.sdmarker.domain.marker.model.TranscriptEntry;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerGroups;
import com.sdmarker.infrastructure.marker.compile.CompiledMarkerSet;
import com.sdmarker.infrastructure.transcript.MessageTextNormalizer;
import com.sdmarker.infrastructure.marker.scoring.DriftDetector;
import com.sdmarker.infrastructure.marker.scoring.EmotionalIntensityScorer;
import com.sdmarker.infrastructure.marker.scoring.SessionAggregator;
import com.sdmarker.infrastructure.marker.scoring.TextScorer;
import com.sdmarker.infrastructure.transcript.TranscriptParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Runs the full pipeline over a transcript: normalize → score, drift scan and intensity per unit → aggregate.
 *
 * Units are scanned on the injected executor and may complete in any order; results are
 * re-sorted by sequence index before aggregation. The first failing unit fails the whole
 * analysis and the units still queued are cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionAnalysisService {

    private final TranscriptParser transcriptParser;
    private final MessageTextNormalizer messageTextNormalizer;
    private final TextScorer textScorer;
    private final DriftDetector driftDetector;
    private final EmotionalIntensityScorer emotionalIntensityScorer;
    private final SessionAggregator sessionAggregator;
    private final CompiledMarkerSet compiledMarkerSet;
    private final CompiledMarkerGroups compiledMarkerGroups;
    private final Executor markerScanExecutor;

    private record UnitResult(int sequenceIndex, ScoreResult score, List<DriftEvent> driftEvents, int intensity) {}

    /**
     * Parse a raw chat export and analyze it.
     */
    public SessionAnalysis analyzeTranscript(String rawContent) {
        List<TranscriptEntry> entries = transcriptParser.parse(rawContent);
        log.info("[SessionAnalysis] Parsed transcript into {} units", entries.size());
        return analyzeEntries(entries, () -> false);
    }

    /**
     * Analyze already separated text units, in transcript order.
     */
    public SessionAnalysis analyze(List<String> texts) {
        List<TranscriptEntry> entries = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            entries.add(new TranscriptEntry(i + 1, TranscriptParser.UNKNOWN_SPEAKER, texts.get(i), null));
        }
        return analyzeEntries(entries, () -> false);
    }

    /**
     * @param cancelled cooperative cancellation signal, checked between text units
     */
    public SessionAnalysis analyzeEntries(List<TranscriptEntry> entries, BooleanSupplier cancelled) {
        if (entries.isEmpty()) {
            throw new EmptyTranscriptException();
        }
        long start = System.currentTimeMillis();
        ScanProgress progress = new ScanProgress(entries.size());

        List<CompletableFuture<UnitResult>> futures = entries.stream()
                .map(entry -> CompletableFuture.supplyAsync(() -> scanUnit(entry, progress, cancelled), markerScanExecutor))
                .toList();

        List<UnitResult> results = new ArrayList<>(progress.total);
        try {
            for (CompletableFuture<UnitResult> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException | CancellationException e) {
            futures.forEach(f -> f.cancel(false));
            RuntimeException failure = progress.failure.get();
            log.warn("[SessionAnalysis] Analysis aborted after {} of {} units: {}",
                    progress.completed.get(), progress.total, failure != null ? failure.getMessage() : e.getMessage());
            throw failure != null ? failure : e;
        }
        results.sort(Comparator.comparingInt(UnitResult::sequenceIndex));

        List<ScoreResult> scores = results.stream().map(UnitResult::score).toList();
        List<Integer> intensities = results.stream().map(UnitResult::intensity).toList();
        List<DriftEvent> driftEvents = results.stream().flatMap(r -> r.driftEvents().stream()).toList();

        SessionProfile profile = sessionAggregator.aggregate(scores, driftEvents, cancelled);

        log.info("[SessionAnalysis] Analyzed {} units in {}ms (dominant={}, driftEvents={})",
                progress.total, System.currentTimeMillis() - start, profile.dominant(), driftEvents.size());
        return new SessionAnalysis(entries, scores, intensities, profile);
    }

    private UnitResult scanUnit(TranscriptEntry entry, ScanProgress progress, BooleanSupplier cancelled) {
        if (progress.failure.get() != null) {
            throw new CancellationException("Skipped after an earlier unit failed");
        }
        try {
            if (cancelled.getAsBoolean()) {
                throw new AnalysisCancelledException(progress.completed.get(), progress.total);
            }
            String text = messageTextNormalizer.normalize(entry.text());
            ScoreResult score = textScorer.score(text, compiledMarkerSet);
            List<DriftEvent> drift = driftDetector.detectUnit(entry.line(), text, compiledMarkerGroups);
            int intensity = emotionalIntensityScorer.score(text);
            progress.completed.incrementAndGet();
            return new UnitResult(entry.line(), score, drift, intensity);
        } catch (RuntimeException e) {
            progress.failure.compareAndSet(null, e);
            throw e;
        }
    }

    // Shared between the worker tasks of one analysis. The first failure stops units not yet started.
    private static final class ScanProgress {
        private final int total;
        private final AtomicInteger completed = new AtomicInteger();
        private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

        ScanProgress(int total) {
            this.total = total;
        }
    }
}
