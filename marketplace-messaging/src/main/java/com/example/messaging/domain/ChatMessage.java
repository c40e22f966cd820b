package com.example.messaging.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private String id;
    private String conversationId;

    /**
     * Position of the message inside its conversation, starting at 1.
     */
    private long sequence;

    private String senderId;
    private String receiverId;
    private ChatMessageType type;

    /**
     * Content as delivered, after redaction.
     */
    private String content;

    /**
     * Content as submitted. Only kept when it differs from {@link #content}. Stored for moderation and never
     * serialized to clients or the event stream.
     */
    @JsonIgnore
    private String originalContent;

    private boolean filtered;
    private Map<String, Object> metadata;
    private ModerationFlags moderation;
    private Instant readAt;
    private Instant createdAt;

    @JsonIgnore
    public boolean isRead() {
        return readAt != null;
    }
}
