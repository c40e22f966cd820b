package com.example.messaging.service;

import com.example.messaging.domain.Conversation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ConversationRepository {

    void save(Conversation conversation);

    Optional<Conversation> findById(String conversationId);

    /**
     * @param participantKey sorted, de-duplicated participant ids as built by {@link ConversationStore#participantKey}
     * @param projectId project reference or {@code null} for conversations outside a project
     */
    Optional<Conversation> findByParticipants(String participantKey, String projectId);

    /**
     * Conversations the user takes part in, most recently active first.
     */
    List<Conversation> findForParticipant(String userId);

    void updateLastActivity(String conversationId, Instant lastActivityAt);
}
