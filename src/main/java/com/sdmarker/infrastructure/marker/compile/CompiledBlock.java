package com.sdmarker.infrastructure.marker.compile;

import com.sdmarker.domain.marker.model.Polarity;

import java.util.List;

public record CompiledBlock(Polarity polarity, double weight, List<CompiledPattern> tokens, List<CompiledPattern> patterns) {

    public CompiledBlock {
        tokens = List.copyOf(tokens);
        patterns = List.copyOf(patterns);
    }
}
