package com.example.messaging.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "conversations",
        uniqueConstraints = @UniqueConstraint(name = "uq_conversations_participants_project",
                columnNames = {"participant_key", "project_key"}))
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "conversation_participants", joinColumns = @JoinColumn(name = "conversation_id"))
    @OrderColumn(name = "position")
    @Column(name = "user_id", nullable = false, length = 128)
    private List<String> participants = new ArrayList<>();

    /**
     * Sorted participant ids, so any ordering of the same set finds the same row.
     */
    @Column(name = "participant_key", nullable = false, updatable = false, length = 1024)
    private String participantKey;

    /**
     * Project id, or the empty string when there is none, so the unique constraint also covers
     * conversations outside a project.
     */
    @Column(name = "project_key", nullable = false, updatable = false, length = 128)
    private String projectKey;

    @Column(name = "project_id", length = 128)
    private String projectId;

    @Column(name = "project_title", length = 255)
    private String projectTitle;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Version
    @Column(name = "version")
    private Long version;
}
