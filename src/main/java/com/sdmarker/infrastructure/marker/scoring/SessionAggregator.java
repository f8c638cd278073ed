package com.sdmarker.infrastructure.marker.scoring;

import com.sdmarker.domain.marker.exception.AnalysisCancelledException;
import com.sdmarker.domain.marker.exception.EmptyTranscriptException;
import com.sdmarker.domain.marker.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * Folds ordered per-text scores into a {@link SessionProfile}.
 *
 * Aggregate policy is the arithmetic mean per category. The dominant category is the one with
 * the highest mean; ties go to the category declared first. Confidence is the dominant's share
 * of all positive means. Trend compares the mean of the second half of the transcript with the
 * mean of the first half (first half = first n/2 units, rounded down).
 *
 * A unit's own stage is its highest-scoring category when that score is positive. A level
 * transition is recorded when a unit's stage differs from the last unit that had one and its
 * score exceeds the transition minimum. Neutral units are skipped, not treated as a stage.
 */
@Slf4j
@Component
public class SessionAggregator {

    private final double trendThreshold;
    private final double transitionMinScore;

    @Autowired
    public SessionAggregator(@Value("${markers.trend-threshold:0.1}") double trendThreshold,
                             @Value("${markers.transition-min-score:1.0}") double transitionMinScore) {
        this.trendThreshold = trendThreshold;
        this.transitionMinScore = transitionMinScore;
    }

    public SessionAggregator() {
        this(0.1, 1.0);
    }

    public SessionProfile aggregate(List<ScoreResult> scores, List<DriftEvent> driftEvents) {
        return aggregate(scores, driftEvents, () -> false);
    }

    /**
     * @param cancelled checked before each text unit; when it returns true aggregation stops
     *                  with {@link AnalysisCancelledException}
     */
    public SessionProfile aggregate(List<ScoreResult> scores, List<DriftEvent> driftEvents, BooleanSupplier cancelled) {
        Objects.requireNonNull(driftEvents, "driftEvents");
        if (scores == null || scores.isEmpty()) {
            throw new EmptyTranscriptException();
        }

        int n = scores.size();
        int half = n / 2;
        List<Category> categories = new ArrayList<>(scores.get(0).scores().keySet());
        double[] totals = new double[categories.size()];
        double[] firstHalf = new double[categories.size()];
        List<LevelTransition> transitions = new ArrayList<>();
        Category lastLevel = null;

        for (int i = 0; i < n; i++) {
            if (cancelled.getAsBoolean()) {
                log.info("[SessionAggregator] Cancelled after {}/{} units", i, n);
                throw new AnalysisCancelledException(i, n);
            }
            ScoreResult result = scores.get(i);
            Category unitLevel = null;
            double unitBest = 0.0;
            for (int c = 0; c < categories.size(); c++) {
                double value = result.score(categories.get(c));
                totals[c] += value;
                if (i < half) {
                    firstHalf[c] += value;
                }
                if (value > unitBest) {
                    unitBest = value;
                    unitLevel = categories.get(c);
                }
            }
            if (unitLevel != null) {
                if (lastLevel != null && unitLevel != lastLevel && unitBest > transitionMinScore) {
                    transitions.add(LevelTransition.of(i + 1, lastLevel, unitLevel, unitBest));
                }
                lastLevel = unitLevel;
            }
        }

        Map<Category, Double> means = new LinkedHashMap<>();
        Map<Category, Trend> trends = new LinkedHashMap<>();
        Category dominant = null;
        double best = Double.NEGATIVE_INFINITY;
        double positiveSum = 0.0;

        for (int c = 0; c < categories.size(); c++) {
            Category category = categories.get(c);
            double mean = totals[c] / n;
            means.put(category, mean);
            trends.put(category, trend(firstHalf[c], totals[c] - firstHalf[c], half, n - half));
            if (mean > best) {
                best = mean;
                dominant = category;
            }
            if (mean > 0) {
                positiveSum += mean;
            }
        }

        double confidence = best > 0 && positiveSum > 0 ? best / positiveSum : 0.0;

        SessionProfile profile = new SessionProfile(means, dominant, confidence, trends, n, driftEvents, transitions);
        log.info("[SessionAggregator] {} units aggregated: dominant={}, confidence={}, driftEvents={}, levelTransitions={}",
                n, dominant, String.format("%.2f", confidence), driftEvents.size(), transitions.size());
        return profile;
    }

    private Trend trend(double firstSum, double secondSum, int firstCount, int secondCount) {
        if (firstCount == 0 || secondCount == 0) {
            return Trend.STABLE;
        }
        double delta = secondSum / secondCount - firstSum / firstCount;
        if (delta > trendThreshold) {
            return Trend.RISING;
        }
        if (delta < -trendThreshold) {
            return Trend.FALLING;
        }
        return Trend.STABLE;
    }
}
