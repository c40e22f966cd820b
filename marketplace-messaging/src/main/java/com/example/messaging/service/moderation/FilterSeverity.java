package com.example.messaging.service.moderation;

public enum FilterSeverity {
    LOW,
    MEDIUM,
    HIGH
}
