package com.example.messaging.dto;

import com.example.messaging.service.moderation.FilterAction;
import com.example.messaging.service.moderation.FilterCategory;
import com.example.messaging.service.moderation.FilterSeverity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateFilterRuleRequest {

    @NotBlank
    private String pattern;

    @NotNull
    private FilterCategory category;

    @NotNull
    private FilterSeverity severity;

    @NotNull
    private FilterAction action;

    private String replacement;

    private String description;

    private boolean caseInsensitive = true;
}
