package com.example.messaging.persistence;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.Conversation;
import com.example.messaging.domain.ModerationFlags;
import com.example.messaging.service.ConversationStore;
import com.example.messaging.service.moderation.FilterRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
@RequiredArgsConstructor
public class MessagingEntityMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ConversationEntity toEntity(Conversation conversation) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(conversation.getId());
        entity.setParticipants(new ArrayList<>(conversation.getParticipants()));
        entity.setParticipantKey(ConversationStore.participantKey(conversation.getParticipants()));
        entity.setProjectKey(projectKey(conversation.getProjectId()));
        entity.setProjectId(conversation.getProjectId());
        entity.setProjectTitle(conversation.getProjectTitle());
        entity.setCreatedAt(conversation.getCreatedAt());
        entity.setLastActivityAt(conversation.getLastActivityAt());
        return entity;
    }

    public Conversation toConversation(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return Conversation.builder()
                .id(entity.getId())
                .participants(List.copyOf(entity.getParticipants()))
                .projectId(entity.getProjectId())
                .projectTitle(entity.getProjectTitle())
                .createdAt(entity.getCreatedAt())
                .lastActivityAt(entity.getLastActivityAt())
                .build();
    }

    public MessageEntity toEntity(ChatMessage message) {
        MessageEntity entity = new MessageEntity();
        entity.setId(message.getId());
        entity.setConversationId(message.getConversationId());
        entity.setSequence(message.getSequence());
        entity.setSenderId(message.getSenderId());
        entity.setReceiverId(message.getReceiverId());
        entity.setType(message.getType());
        entity.setContent(message.getContent());
        entity.setOriginalContent(message.getOriginalContent());
        entity.setFiltered(message.isFiltered());
        entity.setMetadata(writeJson(message.getMetadata()));
        if (message.getModeration() != null) {
            entity.setFlaggedBy(message.getModeration().getFlaggedBy());
            entity.setFlagReason(message.getModeration().getReason());
            entity.setFlaggedAt(message.getModeration().getFlaggedAt());
        }
        entity.setReadAt(message.getReadAt());
        entity.setCreatedAt(message.getCreatedAt());
        return entity;
    }

    public ChatMessage toMessage(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        ModerationFlags moderation = StringUtils.hasText(entity.getFlaggedBy())
                ? ModerationFlags.builder()
                        .flaggedBy(entity.getFlaggedBy())
                        .reason(entity.getFlagReason())
                        .flaggedAt(entity.getFlaggedAt())
                        .build()
                : null;
        return ChatMessage.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .sequence(entity.getSequence())
                .senderId(entity.getSenderId())
                .receiverId(entity.getReceiverId())
                .type(entity.getType())
                .content(entity.getContent())
                .originalContent(entity.getOriginalContent())
                .filtered(entity.isFiltered())
                .metadata(readMap(entity.getMetadata()))
                .moderation(moderation)
                .readAt(entity.getReadAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public FilterRuleEntity toEntity(FilterRule rule) {
        FilterRuleEntity entity = new FilterRuleEntity();
        entity.setId(rule.getId());
        entity.setPattern(rule.getPattern());
        entity.setCategory(rule.getCategory());
        entity.setSeverity(rule.getSeverity());
        entity.setAction(rule.getAction());
        entity.setReplacement(rule.getReplacement());
        entity.setDescription(rule.getDescription());
        entity.setCaseInsensitive(rule.isCaseInsensitive());
        entity.setActive(rule.isActive());
        return entity;
    }

    public FilterRule toRule(FilterRuleEntity entity) {
        return FilterRule.builder()
                .id(entity.getId())
                .pattern(entity.getPattern())
                .category(entity.getCategory())
                .severity(entity.getSeverity())
                .action(entity.getAction())
                .replacement(entity.getReplacement())
                .description(entity.getDescription())
                .caseInsensitive(entity.isCaseInsensitive())
                .active(entity.isActive())
                .build();
    }

    static String projectKey(String projectId) {
        return projectId == null ? "" : projectId;
    }

    private String writeJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize message metadata", e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable message metadata: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
