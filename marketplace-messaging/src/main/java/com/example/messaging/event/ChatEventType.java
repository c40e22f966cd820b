package com.example.messaging.event;

public enum ChatEventType {
    CONVERSATION_CREATED,
    MESSAGE_SENT,
    MESSAGE_READ,
    MESSAGE_FLAGGED,
    USER_ONLINE,
    USER_OFFLINE
}
