package com.example.messaging.service.notification;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.service.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Emails receivers about messages they could not get live.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationThrottler throttler;
    private final AccountDirectory accountDirectory;
    private final NotificationTemplates templates;
    private final Notifier notifier;
    private final ConversationStore conversationStore;
    private final MessagingProperties properties;

    /**
     * Sends a new-message email when the throttler allows it. Failures are logged, never thrown.
     *
     * @return {@code true} when an email was handed to the notifier
     */
    public boolean notifyIfDue(ChatMessage message) {
        if (!properties.getNotification().isEnabled()) {
            return false;
        }
        String recipientId = message.getReceiverId();
        String conversationId = message.getConversationId();
        try {
            if (!throttler.shouldNotify(recipientId, conversationId, message.getType().notificationCategory())) {
                return false;
            }
            String email = accountDirectory.resolveEmail(recipientId).orElse(null);
            if (email == null) {
                return false;
            }
            String projectTitle = conversationStore.find(conversationId).map(Conversation::getProjectTitle).orElse(null);
            EmailContent content = templates.newMessage(
                    accountDirectory.resolveDisplayName(recipientId),
                    accountDirectory.resolveDisplayName(message.getSenderId()),
                    message.getContent(),
                    projectTitle,
                    conversationId);
            notifier.send(email, content.subject(), content.html());
            throttler.recordSent(email, conversationId);
            log.info("Sent message notification to {} for conversation {}", recipientId, conversationId);
            return true;
        } catch (RuntimeException ex) {
            log.warn("Message notification to {} for conversation {} failed: {}", recipientId, conversationId, ex.getMessage(), ex);
            return false;
        }
    }
}
