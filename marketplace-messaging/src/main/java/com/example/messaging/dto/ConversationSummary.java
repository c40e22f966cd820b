package com.example.messaging.dto;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversationSummary {
    Conversation conversation;
    long unreadCount;
    ChatMessage lastMessage;
}
