package com.sdmarker.domain.marker.model;

/**
 * A drift marker hit in a transcript.
 *
 * @param sequenceIndex 1-based position of the text unit in the transcript
 * @param groupName     marker group that fired
 * @param pattern       pattern source that matched
 * @param offset        start offset of the match inside the text unit
 */
public record DriftEvent(
        int sequenceIndex,
        String groupName,
        String pattern,
        int offset
) {
    public boolean isTransition() {
        return MarkerGroup.TRANSITION_MARKERS.equals(groupName);
    }

    public boolean isResistance() {
        return MarkerGroup.RESISTANCE_MARKERS.equals(groupName);
    }
}
