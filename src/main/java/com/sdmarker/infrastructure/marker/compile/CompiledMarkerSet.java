package com.sdmarker.infrastructure.marker.compile;

import com.sdmarker.domain.marker.model.Category;

import java.util.List;

/**
 * Compiled counterpart of a marker set's categories. Read-only; safe to share across threads.
 */
public record CompiledMarkerSet(List<CompiledCategory> categories) {

    public CompiledMarkerSet {
        categories = List.copyOf(categories);
    }

    public List<Category> declaredCategories() {
        return categories.stream().map(CompiledCategory::category).toList();
    }
}
