package com.sdmarker.infrastructure.marker.compile;

import java.util.List;

/**
 * Compiled drift marker groups in declaration order. Read-only; safe to share across threads.
 */
public record CompiledMarkerGroups(List<CompiledMarkerGroup> groups) {

    public CompiledMarkerGroups {
        groups = List.copyOf(groups);
    }

    public static CompiledMarkerGroups empty() {
        return new CompiledMarkerGroups(List.of());
    }
}
