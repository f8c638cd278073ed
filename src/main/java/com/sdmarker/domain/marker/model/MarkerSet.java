package com.sdmarker.domain.marker.model;

import java.util.List;
import java.util.Optional;

/**
 * Loaded taxonomy. Immutable once constructed; shared by reference with every component.
 *
 * @param categories categories in declaration order
 * @param groups     drift marker groups in declaration order
 */
public record MarkerSet(List<CategoryMarkers> categories, List<MarkerGroup> groups) {

    public MarkerSet {
        categories = List.copyOf(categories);
        groups = List.copyOf(groups);
    }

    public List<Category> declaredCategories() {
        return categories.stream().map(CategoryMarkers::category).toList();
    }

    public Optional<CategoryMarkers> find(Category category) {
        return categories.stream().filter(c -> c.category() == category).findFirst();
    }
}
