package com.sdmarker.infrastructure.marker.compile;

import java.util.List;

public record CompiledMarkerGroup(String name, List<CompiledPattern> patterns) {

    public CompiledMarkerGroup {
        patterns = List.copyOf(patterns);
    }
}
