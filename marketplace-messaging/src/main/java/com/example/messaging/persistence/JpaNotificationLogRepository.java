package com.example.messaging.persistence;

import com.example.messaging.domain.NotificationLogEntry;
import com.example.messaging.service.notification.NotificationLogRepository;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaNotificationLogRepository implements NotificationLogRepository {

    private final NotificationLogJpaRepository notificationLogJpaRepository;

    @Override
    @Transactional
    public void append(NotificationLogEntry entry) {
        NotificationLogEntity entity = new NotificationLogEntity();
        entity.setRecipientEmail(entry.getRecipientEmail());
        entity.setConversationId(entry.getConversationId());
        entity.setSentAt(entry.getSentAt());
        notificationLogJpaRepository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsSince(String recipientEmail, String conversationId, Instant since) {
        return notificationLogJpaRepository.existsByRecipientEmailAndConversationIdAndSentAtAfter(
                recipientEmail, conversationId, since);
    }
}
