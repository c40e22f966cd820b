package com.example.messaging.service;

import com.example.messaging.domain.ChatMessage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface MessageRepository {

    void save(ChatMessage message);

    Optional<ChatMessage> findById(String messageId);

    /**
     * Highest sequence assigned in the conversation, or 0 when it has no messages.
     */
    long lastSequence(String conversationId);

    List<ChatMessage> findByConversation(String conversationId);

    Optional<ChatMessage> findLatest(String conversationId);

    List<ChatMessage> findUnread(String conversationId, String receiverId);

    /**
     * Unread message count per conversation for the receiver.
     */
    Map<String, Long> countUnreadByConversation(String receiverId);

    /**
     * Unread messages created at or after {@code since}, across all conversations.
     */
    List<ChatMessage> findUnreadSince(Instant since);

    /**
     * Sets the read timestamp when it is still empty.
     *
     * @return {@code true} if this call marked the message
     */
    boolean markRead(String messageId, Instant readAt);
}
