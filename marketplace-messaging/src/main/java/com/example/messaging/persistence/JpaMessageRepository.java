package com.example.messaging.persistence;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.service.MessageRepository;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JpaMessageRepository implements MessageRepository {

    private final MessageJpaRepository messageJpaRepository;
    private final MessagingEntityMapper mapper;

    @Override
    @Transactional
    public void save(ChatMessage message) {
        messageJpaRepository.saveAndFlush(mapper.toEntity(message));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findById(String messageId) {
        return messageJpaRepository.findById(messageId).map(mapper::toMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public long lastSequence(String conversationId) {
        return messageJpaRepository.findMaxSequence(conversationId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findByConversation(String conversationId) {
        return messageJpaRepository.findByConversationIdOrderBySequenceAsc(conversationId).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findLatest(String conversationId) {
        return messageJpaRepository.findFirstByConversationIdOrderBySequenceDesc(conversationId).map(mapper::toMessage);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findUnread(String conversationId, String receiverId) {
        return messageJpaRepository
                .findByConversationIdAndReceiverIdAndReadAtIsNullOrderBySequenceAsc(conversationId, receiverId).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countUnreadByConversation(String receiverId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : messageJpaRepository.countUnreadByConversation(receiverId)) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findUnreadSince(Instant since) {
        return messageJpaRepository.findByReadAtIsNullAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(since).stream()
                .map(mapper::toMessage)
                .toList();
    }

    @Override
    @Transactional
    public boolean markRead(String messageId, Instant readAt) {
        return messageJpaRepository.markRead(messageId, readAt) > 0;
    }
}
