package com.example.messaging.dto;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.util.StringUtils;

/**
 * Either {@code participants} or {@code recipientId} names the other side. The caller is always added.
 */
@Data
public class CreateConversationRequest {

    private List<String> participants = new ArrayList<>();

    private String recipientId;

    private String projectId;

    private String projectTitle;

    public List<String> otherParticipants() {
        List<String> others = new ArrayList<>();
        if (participants != null) {
            others.addAll(participants);
        }
        if (StringUtils.hasText(recipientId)) {
            others.add(recipientId);
        }
        return others;
    }
}
