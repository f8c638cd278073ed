package com.sdmarker.domain.marker.exception;

import com.sdmarker.domain.marker.model.Category;
import com.sdmarker.domain.marker.model.Polarity;

/**
 * One pattern that failed to compile.
 *
 * @param category    owning category, null for drift group patterns
 * @param polarity    owning polarity block, null for drift group patterns
 * @param groupName   owning drift group, null for category patterns
 * @param pattern     offending source string
 * @param description regex engine message
 * @param index       position of the error inside {@code pattern}, -1 when unknown
 */
public record PatternCompileError(
        Category category,
        Polarity polarity,
        String groupName,
        String pattern,
        String description,
        int index
) {
    public String location() {
        if (groupName != null) {
            return groupName;
        }
        return category.configKey() + "/" + polarity.configKey();
    }
}
