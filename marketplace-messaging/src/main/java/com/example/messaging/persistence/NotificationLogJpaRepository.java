package com.example.messaging.persistence;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationLogJpaRepository extends JpaRepository<NotificationLogEntity, Long> {

    boolean existsByRecipientEmailAndConversationIdAndSentAtAfter(String recipientEmail, String conversationId, Instant since);
}
