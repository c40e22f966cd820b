package com.example.messaging.service.notification;

import com.example.messaging.domain.NotificationCategory;
import java.util.Optional;

/**
 * Read-only view of user accounts owned by the rest of the marketplace.
 */
public interface AccountDirectory {

    String resolveDisplayName(String userId);

    Optional<String> resolveEmail(String userId);

    /**
     * Whether the user wants email for the category. Users without stored preferences get the defaults:
     * messages and payments on, daily digest off.
     */
    boolean getNotificationPreference(String userId, NotificationCategory category);
}
