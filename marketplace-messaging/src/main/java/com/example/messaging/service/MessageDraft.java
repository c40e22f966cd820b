package com.example.messaging.service;

import com.example.messaging.domain.ChatMessageType;
import java.util.Map;
import lombok.Builder;

/**
 * A message as submitted, before filtering and persistence. {@code receiverId} may be left empty in
 * two-party conversations.
 */
@Builder
public record MessageDraft(
        String conversationId,
        String senderId,
        String receiverId,
        ChatMessageType type,
        String content,
        Map<String, Object> metadata) {
}
