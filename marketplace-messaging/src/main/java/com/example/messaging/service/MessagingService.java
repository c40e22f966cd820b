package com.example.messaging.service;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.dto.ConversationSummary;
import com.example.messaging.dto.ReadReceipt;
import com.example.messaging.event.ChatEvent;
import com.example.messaging.event.ChatEventPublisher;
import com.example.messaging.event.ChatEventType;
import com.example.messaging.event.ChatMessageEvent;
import com.example.messaging.service.exception.NotFoundException;
import com.example.messaging.service.exception.UnauthorizedException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for the REST controllers and the socket gateway. State changes are persisted first and only
 * then announced, so a failure after persistence never loses a message.
 */
@Service
@RequiredArgsConstructor
public class MessagingService {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final ChatEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Finds or creates the conversation between the caller and {@code otherParticipants}. Only a newly
     * created conversation is announced.
     */
    public Conversation createConversation(AuthenticatedPrincipal principal, List<String> otherParticipants,
            String projectId, String projectTitle) {
        List<String> participants = new ArrayList<>();
        participants.add(principal.getUserId());
        if (otherParticipants != null) {
            participants.addAll(otherParticipants);
        }
        ConversationStore.Resolution resolution = conversationStore.findOrCreate(participants, projectId, projectTitle);
        Conversation conversation = resolution.conversation();
        if (resolution.created()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("conversation", conversation);
            payload.put("createdBy", principal.getUserId());
            eventPublisher.publishLifecycleEvent(ChatEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .type(ChatEventType.CONVERSATION_CREATED)
                    .conversationId(conversation.getId())
                    .userId(principal.getUserId())
                    .occurredAt(clock.instant())
                    .payload(payload)
                    .build());
        }
        return conversation;
    }

    public ChatMessage sendMessage(AuthenticatedPrincipal principal, MessageDraft draft) {
        if (draft.senderId() != null && !draft.senderId().equals(principal.getUserId())) {
            throw new UnauthorizedException("Cannot send messages on behalf of another user");
        }
        MessageDraft authored = new MessageDraft(draft.conversationId(), principal.getUserId(), draft.receiverId(),
                draft.type(), draft.content(), draft.metadata());
        ChatMessage message = messageStore.append(authored);

        eventPublisher.publishMessageEvent(ChatMessageEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .conversationId(message.getConversationId())
                .message(message)
                .occurredAt(message.getCreatedAt())
                .build());
        publish(ChatEventType.MESSAGE_SENT, message, Map.of(
                "messageId", message.getId(),
                "receiverId", message.getReceiverId(),
                "type", message.getType().name(),
                "filtered", message.isFiltered()));
        if (message.getModeration() != null) {
            publish(ChatEventType.MESSAGE_FLAGGED, message, Map.of(
                    "messageId", message.getId(),
                    "reason", message.getModeration().getReason()));
        }
        return message;
    }

    /**
     * @return {@code true} when the message was newly marked read
     */
    public boolean markRead(AuthenticatedPrincipal principal, String messageId) {
        return messageStore.markRead(messageId, principal.getUserId())
                .map(message -> {
                    publishReadReceipt(message);
                    return true;
                })
                .orElse(false);
    }

    public int markConversationRead(AuthenticatedPrincipal principal, String conversationId) {
        List<ChatMessage> marked = messageStore.markConversationRead(conversationId, principal.getUserId());
        marked.forEach(this::publishReadReceipt);
        return marked.size();
    }

    public Conversation getConversation(AuthenticatedPrincipal principal, String conversationId) {
        return conversationStore.find(conversationId)
                .filter(conversation -> conversation.hasParticipant(principal.getUserId()) || principal.isAdmin())
                .orElseThrow(() -> new NotFoundException("Conversation %s not found".formatted(conversationId)));
    }

    public List<ChatMessage> listMessages(AuthenticatedPrincipal principal, String conversationId) {
        return messageStore.listByConversation(conversationId, principal.getUserId());
    }

    public List<ConversationSummary> listConversations(AuthenticatedPrincipal principal) {
        Map<String, Long> unread = messageStore.unreadCounts(principal.getUserId());
        return conversationStore.listForUser(principal.getUserId()).stream()
                .map(conversation -> ConversationSummary.builder()
                        .conversation(conversation)
                        .unreadCount(unread.getOrDefault(conversation.getId(), 0L))
                        .lastMessage(messageStore.latest(conversation.getId()).orElse(null))
                        .build())
                .toList();
    }

    private void publishReadReceipt(ChatMessage message) {
        ReadReceipt receipt = ReadReceipt.builder()
                .messageId(message.getId())
                .conversationId(message.getConversationId())
                .readerId(message.getReceiverId())
                .readAt(message.getReadAt())
                .build();
        publish(ChatEventType.MESSAGE_READ, message, Map.of("receipt", receipt, "senderId", message.getSenderId()));
    }

    private void publish(ChatEventType type, ChatMessage message, Map<String, Object> payload) {
        eventPublisher.publishLifecycleEvent(ChatEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .conversationId(message.getConversationId())
                .userId(message.getSenderId())
                .occurredAt(clock.instant())
                .payload(payload)
                .build());
    }
}
