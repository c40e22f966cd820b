package com.example.messaging.service.moderation;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ViolationStats {

    /**
     * Number of texts with at least one violation.
     */
    long total;

    Map<FilterCategory, Long> byCategory;
    Map<FilterSeverity, Long> bySeverity;
}
