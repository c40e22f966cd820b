package com.example.messaging.support;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.service.MessageRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryMessageRepository implements MessageRepository {

    private final Map<String, ChatMessage> messages = new ConcurrentHashMap<>();

    @Override
    public void save(ChatMessage message) {
        boolean duplicateSequence = messages.values().stream()
                .anyMatch(m -> m.getConversationId().equals(message.getConversationId())
                        && m.getSequence() == message.getSequence()
                        && !m.getId().equals(message.getId()));
        if (duplicateSequence) {
            throw new IllegalStateException("Duplicate sequence " + message.getSequence());
        }
        messages.put(message.getId(), message.toBuilder().build());
    }

    @Override
    public Optional<ChatMessage> findById(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public long lastSequence(String conversationId) {
        return messages.values().stream()
                .filter(m -> m.getConversationId().equals(conversationId))
                .mapToLong(ChatMessage::getSequence)
                .max()
                .orElse(0);
    }

    @Override
    public List<ChatMessage> findByConversation(String conversationId) {
        return messages.values().stream()
                .filter(m -> m.getConversationId().equals(conversationId))
                .sorted(Comparator.comparingLong(ChatMessage::getSequence))
                .toList();
    }

    @Override
    public Optional<ChatMessage> findLatest(String conversationId) {
        return messages.values().stream()
                .filter(m -> m.getConversationId().equals(conversationId))
                .max(Comparator.comparingLong(ChatMessage::getSequence));
    }

    @Override
    public List<ChatMessage> findUnread(String conversationId, String receiverId) {
        return findByConversation(conversationId).stream()
                .filter(m -> m.getReceiverId().equals(receiverId) && !m.isRead())
                .toList();
    }

    @Override
    public Map<String, Long> countUnreadByConversation(String receiverId) {
        return messages.values().stream()
                .filter(m -> m.getReceiverId().equals(receiverId) && !m.isRead())
                .collect(Collectors.groupingBy(ChatMessage::getConversationId, TreeMap::new, Collectors.counting()));
    }

    @Override
    public List<ChatMessage> findUnreadSince(Instant since) {
        return messages.values().stream()
                .filter(m -> !m.isRead() && !m.getCreatedAt().isBefore(since))
                .sorted(Comparator.comparing(ChatMessage::getCreatedAt).thenComparingLong(ChatMessage::getSequence))
                .toList();
    }

    @Override
    public synchronized boolean markRead(String messageId, Instant readAt) {
        ChatMessage message = messages.get(messageId);
        if (message == null || message.isRead()) {
            return false;
        }
        messages.put(messageId, message.toBuilder().readAt(readAt).build());
        return true;
    }

    public int size() {
        return messages.size();
    }
}
