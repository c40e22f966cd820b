package com.example.messaging.service.moderation;

import java.io.Serializable;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FilterVerdict implements Serializable {

    String originalText;
    String filteredText;
    List<FilterViolation> violations;
    boolean blocked;
    boolean requiresReview;

    public static FilterVerdict clean(String text) {
        return FilterVerdict.builder()
                .originalText(text)
                .filteredText(text)
                .violations(List.of())
                .blocked(false)
                .requiresReview(false)
                .build();
    }

    public boolean isRedacted() {
        return !originalText.equals(filteredText);
    }

    public Set<FilterCategory> categories() {
        if (violations.isEmpty()) {
            return EnumSet.noneOf(FilterCategory.class);
        }
        return violations.stream()
                .map(FilterViolation::getCategory)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(FilterCategory.class)));
    }

    public Set<FilterCategory> blockingCategories() {
        return violations.stream()
                .filter(violation -> violation.getSeverity() == FilterSeverity.HIGH)
                .filter(violation -> violation.getAction() == FilterAction.FLAG_ONLY)
                .map(FilterViolation::getCategory)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(FilterCategory.class)));
    }
}
