package com.example.messaging.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MarkConversationReadResponse {
    String conversationId;
    int markedRead;
}
