package com.sdmarker.infrastructure.marker.compile;

import com.sdmarker.domain.marker.model.Category;

public record CompiledCategory(Category category, CompiledBlock positive, CompiledBlock negative) {}
