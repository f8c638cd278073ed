package com.sdmarker.domain.marker.model;

import java.util.List;

/**
 * Named drift marker group. Presence-only: no weights, no categories.
 *
 * @param name     group name as declared, e.g. "Transition_Markers"
 * @param patterns flattened pattern list in declaration order
 */
public record MarkerGroup(String name, List<String> patterns) {

    public static final String TRANSITION_MARKERS = "Transition_Markers";
    public static final String RESISTANCE_MARKERS = "Resistance_Markers";

    public MarkerGroup {
        patterns = List.copyOf(patterns);
    }
}
