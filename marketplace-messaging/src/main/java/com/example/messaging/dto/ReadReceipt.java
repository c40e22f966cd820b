package com.example.messaging.dto;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Sent to the original sender when the receiver reads a message.
 */
@Value
@Builder
public class ReadReceipt {
    String messageId;
    String conversationId;
    String readerId;
    Instant readAt;
}
