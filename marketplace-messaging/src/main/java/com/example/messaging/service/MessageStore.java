package com.example.messaging.service;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.ChatMessageType;
import com.example.messaging.domain.Conversation;
import com.example.messaging.domain.ModerationFlags;
import com.example.messaging.service.exception.ContentBlockedException;
import com.example.messaging.service.exception.NotFoundException;
import com.example.messaging.service.exception.ServiceException;
import com.example.messaging.service.exception.UnauthorizedException;
import com.example.messaging.service.moderation.ContentFilterEngine;
import com.example.messaging.service.moderation.FilterCategory;
import com.example.messaging.service.moderation.FilterVerdict;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns the message log. Every message passes the content filter before it is stored, and appends to one
 * conversation are serialized so sequences stay gap-free and ordered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageStore {

    static final String CONTENT_FILTER = "content-filter";

    private final MessageRepository repository;
    private final ConversationStore conversationStore;
    private final ContentFilterEngine contentFilter;
    private final ConversationLocks locks;
    private final RedisKeyFactory keyFactory;
    private final Clock clock;

    public ChatMessage append(MessageDraft draft) {
        Conversation conversation = conversationStore.get(draft.conversationId());
        if (!conversation.hasParticipant(draft.senderId())) {
            throw new UnauthorizedException("User %s is not a participant of conversation %s"
                    .formatted(draft.senderId(), conversation.getId()));
        }
        String receiverId = resolveReceiver(conversation, draft);
        ChatMessageType type = draft.type() == null ? ChatMessageType.TEXT : draft.type();
        if (!StringUtils.hasText(draft.content())) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Message content is required", MessageMetadataValidator.CODE);
        }
        MessageMetadataValidator.validate(type, draft.metadata());

        FilterVerdict verdict = contentFilter.evaluate(draft.content());
        if (verdict.isBlocked()) {
            log.info("Blocked message from {} in conversation {}: {}", draft.senderId(), conversation.getId(),
                    verdict.blockingCategories());
            throw new ContentBlockedException(verdict.blockingCategories());
        }

        return locks.withLock(keyFactory.conversationLockKey(conversation.getId()), () -> {
            Instant now = clock.instant();
            ChatMessage message = ChatMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .conversationId(conversation.getId())
                    .sequence(repository.lastSequence(conversation.getId()) + 1)
                    .senderId(draft.senderId())
                    .receiverId(receiverId)
                    .type(type)
                    .content(verdict.getFilteredText())
                    .originalContent(verdict.isRedacted() ? verdict.getOriginalText() : null)
                    .filtered(verdict.isRedacted())
                    .metadata(draft.metadata() == null ? Map.of() : new LinkedHashMap<>(draft.metadata()))
                    .moderation(verdict.isRequiresReview() ? flags(verdict, now) : null)
                    .createdAt(now)
                    .build();
            repository.save(message);
            conversationStore.touch(conversation.getId(), now);
            if (message.getModeration() != null) {
                log.info("Message {} in conversation {} flagged for review: {}", message.getId(),
                        conversation.getId(), message.getModeration().getReason());
            }
            return message;
        });
    }

    /**
     * Messages of the conversation in order, or an empty list when the user does not take part in it.
     */
    public List<ChatMessage> listByConversation(String conversationId, String requestingUserId) {
        if (!conversationStore.isParticipant(conversationId, requestingUserId)) {
            return List.of();
        }
        return repository.findByConversation(conversationId);
    }

    public Optional<ChatMessage> find(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return Optional.empty();
        }
        return repository.findById(messageId);
    }

    public Optional<ChatMessage> latest(String conversationId) {
        return repository.findLatest(conversationId);
    }

    public Map<String, Long> unreadCounts(String receiverId) {
        return repository.countUnreadByConversation(receiverId);
    }

    /**
     * Marks the message read when the user is its receiver and it has not been read yet.
     *
     * @return the message with its read timestamp when this call changed it, otherwise empty
     */
    public Optional<ChatMessage> markRead(String messageId, String userId) {
        ChatMessage message = find(messageId)
                .orElseThrow(() -> new NotFoundException("Message %s not found".formatted(messageId)));
        if (!message.getReceiverId().equals(userId) || message.isRead()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (!repository.markRead(messageId, now)) {
            return Optional.empty();
        }
        return Optional.of(message.toBuilder().readAt(now).build());
    }

    /**
     * Marks every unread message addressed to the user in the conversation.
     */
    public List<ChatMessage> markConversationRead(String conversationId, String userId) {
        if (!conversationStore.isParticipant(conversationId, userId)) {
            return List.of();
        }
        Instant now = clock.instant();
        List<ChatMessage> marked = new ArrayList<>();
        for (ChatMessage message : repository.findUnread(conversationId, userId)) {
            if (repository.markRead(message.getId(), now)) {
                marked.add(message.toBuilder().readAt(now).build());
            }
        }
        return marked;
    }

    public List<ChatMessage> unreadSince(Instant since) {
        return repository.findUnreadSince(since);
    }

    private String resolveReceiver(Conversation conversation, MessageDraft draft) {
        if (!StringUtils.hasText(draft.receiverId())) {
            List<String> others = conversation.getParticipants().stream()
                    .filter(participant -> !participant.equals(draft.senderId()))
                    .toList();
            if (others.size() != 1) {
                throw new ServiceException(HttpStatus.BAD_REQUEST,
                        "receiverId is required in conversations with more than two participants", MessageMetadataValidator.CODE);
            }
            return others.get(0);
        }
        if (!conversation.hasParticipant(draft.receiverId()) || draft.receiverId().equals(draft.senderId())) {
            throw new ServiceException(HttpStatus.BAD_REQUEST,
                    "Receiver %s is not another participant of the conversation".formatted(draft.receiverId()),
                    MessageMetadataValidator.CODE);
        }
        return draft.receiverId();
    }

    private static ModerationFlags flags(FilterVerdict verdict, Instant now) {
        return ModerationFlags.builder()
                .flaggedBy(CONTENT_FILTER)
                .reason(verdict.categories().stream().map(FilterCategory::name).collect(Collectors.joining(",")))
                .flaggedAt(now)
                .build();
    }
}
