package com.sdmarker.domain.marker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate over a transcript.
 *
 * @param aggregateScores mean score per category, in declaration order
 * @param dominant        category with the highest mean (earliest declared wins ties)
 * @param confidence      dominant's share of all positive means, 0.0 to 1.0
 * @param trends          second-half vs first-half movement per category
 * @param textUnitCount   number of text units aggregated
 * @param driftEvents     drift events, unmodified
 * @param levelTransitions changes of the per-unit dominant stage, in transcript order
 */
public record SessionProfile(
        Map<Category, Double> aggregateScores,
        Category dominant,
        double confidence,
        Map<Category, Trend> trends,
        int textUnitCount,
        List<DriftEvent> driftEvents,
        List<LevelTransition> levelTransitions
) {
    public SessionProfile {
        aggregateScores = Collections.unmodifiableMap(new LinkedHashMap<>(aggregateScores));
        trends = Collections.unmodifiableMap(new LinkedHashMap<>(trends));
        driftEvents = List.copyOf(driftEvents);
        levelTransitions = List.copyOf(levelTransitions);
    }

    public long transitionCount() {
        return driftEvents.stream().filter(DriftEvent::isTransition).count();
    }

    public long resistanceCount() {
        return driftEvents.stream().filter(DriftEvent::isResistance).count();
    }
}
