package com.example.messaging.service;

import com.example.messaging.domain.Conversation;
import com.example.messaging.service.exception.NotFoundException;
import com.example.messaging.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Owns conversations. A participant set (plus optional project) maps to at most one conversation,
 * whatever order the participants are given in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationStore {

    private static final String KEY_SEPARATOR = "|";

    private final ConversationRepository repository;
    private final ConversationLocks locks;
    private final RedisKeyFactory keyFactory;
    private final Clock clock;

    public record Resolution(Conversation conversation, boolean created) {
    }

    public Resolution findOrCreate(List<String> participants, String projectId, String projectTitle) {
        List<String> distinct = normalizeParticipants(participants);
        String project = StringUtils.hasText(projectId) ? projectId.trim() : null;
        String participantKey = participantKey(distinct);

        Optional<Conversation> existing = findExisting(participantKey, project, distinct);
        if (existing.isPresent()) {
            return new Resolution(existing.get(), false);
        }

        String lockKey = keyFactory.participantSetLockKey(participantKey + KEY_SEPARATOR + Objects.toString(project, ""));
        return locks.withLock(lockKey, () -> {
            Optional<Conversation> raced = findExisting(participantKey, project, distinct);
            if (raced.isPresent()) {
                return new Resolution(raced.get(), false);
            }
            Instant now = clock.instant();
            Conversation conversation = Conversation.builder()
                    .id(UUID.randomUUID().toString())
                    .participants(List.copyOf(distinct))
                    .projectId(project)
                    .projectTitle(project == null ? null : projectTitle)
                    .createdAt(now)
                    .lastActivityAt(now)
                    .build();
            try {
                repository.save(conversation);
            } catch (DataIntegrityViolationException ex) {
                // another instance created the same participant set first
                return findExisting(participantKey, project, distinct)
                        .map(winner -> new Resolution(winner, false))
                        .orElseThrow(() -> ex);
            }
            log.info("Created conversation {} for {} participants (project={})", conversation.getId(), distinct.size(), project);
            return new Resolution(conversation, true);
        });
    }

    public Optional<Conversation> find(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return repository.findById(conversationId);
    }

    public Conversation get(String conversationId) {
        return find(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation %s not found".formatted(conversationId)));
    }

    public boolean isParticipant(String conversationId, String userId) {
        return find(conversationId).map(conversation -> conversation.hasParticipant(userId)).orElse(false);
    }

    public List<Conversation> listForUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            return List.of();
        }
        return repository.findForParticipant(userId);
    }

    public void touch(String conversationId, Instant at) {
        repository.updateLastActivity(conversationId, at);
    }

    /**
     * Order-independent key of a participant set. Every id is prefixed with its length, so ids containing the
     * separator cannot make two different sets share a key.
     */
    public static String participantKey(List<String> participants) {
        return participants.stream()
                .sorted()
                .map(participant -> participant.length() + ":" + participant)
                .collect(Collectors.joining(KEY_SEPARATOR));
    }

    private Optional<Conversation> findExisting(String participantKey, String project, List<String> participants) {
        return repository.findByParticipants(participantKey, project).filter(found -> {
            if (Set.copyOf(found.getParticipants()).equals(Set.copyOf(participants))) {
                return true;
            }
            log.warn("Conversation {} matched key {} but has participants {}", found.getId(), participantKey,
                    found.getParticipants());
            return false;
        });
    }

    private static List<String> normalizeParticipants(List<String> participants) {
        if (participants == null) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Participants are required", "INVALID_PARTICIPANTS");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String participant : participants) {
            if (!StringUtils.hasText(participant)) {
                throw new ServiceException(HttpStatus.BAD_REQUEST, "Participant ids must not be blank", "INVALID_PARTICIPANTS");
            }
            distinct.add(participant.trim());
        }
        if (distinct.size() < 2) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "A conversation needs at least two distinct participants", "INVALID_PARTICIPANTS");
        }
        return new ArrayList<>(distinct);
    }
}
