package com.example.messaging.support;

import com.example.messaging.domain.NotificationLogEntry;
import com.example.messaging.service.notification.NotificationLogRepository;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryNotificationLogRepository implements NotificationLogRepository {

    private final List<NotificationLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(NotificationLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public boolean existsSince(String recipientEmail, String conversationId, Instant since) {
        return entries.stream().anyMatch(entry -> entry.getRecipientEmail().equals(recipientEmail)
                && entry.getConversationId().equals(conversationId)
                && entry.getSentAt().isAfter(since));
    }

    public List<NotificationLogEntry> entries() {
        return List.copyOf(entries);
    }
}
