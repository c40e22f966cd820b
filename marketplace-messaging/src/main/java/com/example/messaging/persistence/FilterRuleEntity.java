package com.example.messaging.persistence;

import com.example.messaging.service.moderation.FilterAction;
import com.example.messaging.service.moderation.FilterCategory;
import com.example.messaging.service.moderation.FilterSeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "content_filters")
public class FilterRuleEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "pattern", nullable = false, columnDefinition = "text")
    private String pattern;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private FilterCategory category;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 16)
    private FilterSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 32)
    private FilterAction action;

    @Column(name = "replacement", length = 255)
    private String replacement;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "case_insensitive", nullable = false)
    private boolean caseInsensitive;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
