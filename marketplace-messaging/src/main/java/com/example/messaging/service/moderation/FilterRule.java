package com.example.messaging.service.moderation;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FilterRule implements Serializable {

    public static final String CUSTOM_PREFIX = "custom_";
    public static final String DEFAULT_REPLACEMENT = "[REMOVED - Please use platform messaging]";

    private String id;

    /**
     * {@link java.util.regex.Pattern} source.
     */
    private String pattern;

    private FilterCategory category;
    private FilterSeverity severity;
    private FilterAction action;
    private String replacement;
    private String description;

    @Builder.Default
    private boolean caseInsensitive = true;

    @Builder.Default
    private boolean active = true;

    public boolean isCustom() {
        return id != null && id.startsWith(CUSTOM_PREFIX);
    }

    public boolean redacts() {
        return action == FilterAction.REDACT_AND_FLAG;
    }

    public String effectiveReplacement() {
        return replacement != null ? replacement : DEFAULT_REPLACEMENT;
    }
}
