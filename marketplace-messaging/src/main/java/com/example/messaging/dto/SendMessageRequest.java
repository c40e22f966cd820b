package com.example.messaging.dto;

import com.example.messaging.domain.ChatMessageType;
import jakarta.validation.constraints.NotBlank;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class SendMessageRequest {

    private String receiverId;

    @NotBlank
    private String content;

    private ChatMessageType type = ChatMessageType.TEXT;

    private Map<String, Object> metadata = new HashMap<>();
}
