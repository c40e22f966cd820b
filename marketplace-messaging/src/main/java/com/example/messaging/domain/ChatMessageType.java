package com.example.messaging.domain;

public enum ChatMessageType {
    TEXT(NotificationCategory.MESSAGES),
    FILE(NotificationCategory.MESSAGES),
    PAYMENT_REQUEST(NotificationCategory.PAYMENTS),
    PAYMENT_RELEASE(NotificationCategory.PAYMENTS),
    ESCROW_NOTICE(NotificationCategory.PAYMENTS);

    private final NotificationCategory notificationCategory;

    ChatMessageType(NotificationCategory notificationCategory) {
        this.notificationCategory = notificationCategory;
    }

    public NotificationCategory notificationCategory() {
        return notificationCategory;
    }
}
