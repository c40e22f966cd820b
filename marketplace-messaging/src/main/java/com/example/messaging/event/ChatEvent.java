package com.example.messaging.event;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatEvent implements Serializable {

    private String eventId;
    private ChatEventType type;

    /**
     * Conversation the event belongs to, or {@code null} for presence events.
     */
    private String conversationId;

    private String userId;
    private Instant occurredAt;
    private Map<String, Object> payload;

    /**
     * Partition key: the conversation when there is one, otherwise the user.
     */
    public String key() {
        return conversationId != null ? conversationId : userId;
    }
}
