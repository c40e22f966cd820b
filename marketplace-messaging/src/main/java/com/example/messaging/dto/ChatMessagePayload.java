package com.example.messaging.dto;

import com.example.messaging.domain.ChatMessageType;
import jakarta.validation.constraints.NotBlank;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

/**
 * Body of the {@code send_message} socket event.
 */
@Data
public class ChatMessagePayload {

    @NotBlank
    private String conversationId;

    /**
     * Optional. When present it must match the authenticated user.
     */
    private String senderId;

    private String receiverId;

    @NotBlank
    private String content;

    private ChatMessageType type = ChatMessageType.TEXT;

    private Map<String, Object> metadata = new HashMap<>();
}
