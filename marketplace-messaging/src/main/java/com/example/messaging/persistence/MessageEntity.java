package com.example.messaging.persistence;

import com.example.messaging.domain.ChatMessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "uq_messages_conversation_sequence",
                columnNames = {"conversation_id", "sequence"}),
        indexes = @Index(name = "idx_messages_receiver_unread", columnList = "receiver_id, read_at"))
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "sender_id", nullable = false, length = 128)
    private String senderId;

    @Column(name = "receiver_id", nullable = false, length = 128)
    private String receiverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 32)
    private ChatMessageType type;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "original_content", columnDefinition = "text")
    private String originalContent;

    @Column(name = "filtered", nullable = false)
    private boolean filtered;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "flagged_by", length = 64)
    private String flaggedBy;

    @Column(name = "flag_reason", length = 255)
    private String flagReason;

    @Column(name = "flagged_at")
    private Instant flaggedAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version")
    private Long version;
}
