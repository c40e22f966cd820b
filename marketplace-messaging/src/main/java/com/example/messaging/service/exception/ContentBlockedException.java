package com.example.messaging.service.exception;

import com.example.messaging.service.moderation.FilterCategory;
import java.util.Set;
import org.springframework.http.HttpStatus;

/**
 * Raised when the content filter refuses a message outright. Nothing has been persisted.
 */
public class ContentBlockedException extends ServiceException {

    public static final String CODE = "CONTENT_BLOCKED";

    private final Set<FilterCategory> categories;

    public ContentBlockedException(Set<FilterCategory> categories) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, describe(categories), CODE);
        this.categories = Set.copyOf(categories);
    }

    public Set<FilterCategory> getCategories() {
        return categories;
    }

    private static String describe(Set<FilterCategory> categories) {
        return "Message blocked: sharing off-platform contact details is not allowed (" + categories + ")";
    }
}
