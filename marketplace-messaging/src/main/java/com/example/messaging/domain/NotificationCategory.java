package com.example.messaging.domain;

public enum NotificationCategory {
    MESSAGES,
    PAYMENTS,
    DAILY_DIGEST
}
