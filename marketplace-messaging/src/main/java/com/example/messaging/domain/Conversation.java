package com.example.messaging.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {

    private String id;

    /**
     * Participants in the order they were supplied at creation. Never changes afterwards.
     */
    @Setter(AccessLevel.NONE)
    private List<String> participants;

    private String projectId;
    private String projectTitle;
    private Instant createdAt;
    private Instant lastActivityAt;

    public boolean hasParticipant(String userId) {
        return userId != null && participants != null && participants.contains(userId);
    }
}
