package com.example.messaging.persistence;

import com.example.messaging.domain.Conversation;
import com.example.messaging.service.ConversationRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaConversationRepository implements ConversationRepository {

    private final ConversationJpaRepository conversationJpaRepository;
    private final MessagingEntityMapper mapper;

    @Override
    @Transactional
    public void save(Conversation conversation) {
        conversationJpaRepository.saveAndFlush(mapper.toEntity(conversation));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findById(String conversationId) {
        return conversationJpaRepository.findById(conversationId).map(mapper::toConversation);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findByParticipants(String participantKey, String projectId) {
        return conversationJpaRepository
                .findByParticipantKeyAndProjectKey(participantKey, MessagingEntityMapper.projectKey(projectId))
                .map(mapper::toConversation);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Conversation> findForParticipant(String userId) {
        return conversationJpaRepository.findForParticipant(userId).stream()
                .map(mapper::toConversation)
                .toList();
    }

    @Override
    @Transactional
    public void updateLastActivity(String conversationId, Instant lastActivityAt) {
        conversationJpaRepository.updateLastActivity(conversationId, lastActivityAt);
    }
}
