package com.example.messaging.service.notification;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.domain.NotificationCategory;
import com.example.messaging.domain.NotificationLogEntry;
import com.example.messaging.service.presence.PresenceTracker;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether an offline email may go out. Online recipients never get one, recipients who opted out
 * of the category never get one, and a recipient gets at most one per conversation inside the window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationThrottler {

    private final PresenceTracker presenceTracker;
    private final AccountDirectory accountDirectory;
    private final NotificationLogRepository logRepository;
    private final MessagingProperties properties;
    private final Clock clock;

    public boolean shouldNotify(String recipientId, String conversationId) {
        return shouldNotify(recipientId, conversationId, NotificationCategory.MESSAGES);
    }

    public boolean shouldNotify(String recipientId, String conversationId, NotificationCategory category) {
        if (presenceTracker.isOnline(recipientId)) {
            log.debug("Recipient {} is online, no email for conversation {}", recipientId, conversationId);
            return false;
        }
        if (!preferenceEnabled(recipientId, category)) {
            log.debug("Recipient {} opted out of {} emails", recipientId, category);
            return false;
        }
        String email = accountDirectory.resolveEmail(recipientId).orElse(null);
        if (email == null) {
            log.debug("Recipient {} has no email address", recipientId);
            return false;
        }
        Instant since = clock.instant().minus(properties.getNotification().getWindow());
        try {
            if (logRepository.existsSince(email, conversationId, since)) {
                log.debug("Recipient {} already emailed about conversation {} since {}", recipientId, conversationId, since);
                return false;
            }
        } catch (RuntimeException ex) {
            log.warn("Could not check notification log for conversation {}, sending anyway", conversationId, ex);
        }
        return true;
    }

    public void recordSent(String recipientEmail, String conversationId) {
        logRepository.append(NotificationLogEntry.builder()
                .recipientEmail(recipientEmail)
                .conversationId(conversationId)
                .sentAt(clock.instant())
                .build());
    }

    private boolean preferenceEnabled(String recipientId, NotificationCategory category) {
        try {
            return accountDirectory.getNotificationPreference(recipientId, category);
        } catch (RuntimeException ex) {
            log.warn("Could not load preferences of {}, assuming {} emails are wanted", recipientId, category, ex);
            return true;
        }
    }
}
