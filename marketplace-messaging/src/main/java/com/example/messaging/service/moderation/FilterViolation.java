package com.example.messaging.service.moderation;

import java.io.Serializable;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FilterViolation implements Serializable {

    String ruleId;
    FilterCategory category;
    String match;
    int position;
    FilterSeverity severity;
    FilterAction action;
}
