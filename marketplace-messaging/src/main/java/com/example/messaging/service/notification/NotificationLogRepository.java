package com.example.messaging.service.notification;

import com.example.messaging.domain.NotificationLogEntry;
import java.time.Instant;

public interface NotificationLogRepository {

    void append(NotificationLogEntry entry);

    /**
     * Whether an email went to the recipient about the conversation strictly after {@code since}.
     */
    boolean existsSince(String recipientEmail, String conversationId, Instant since);
}
