package com.example.messaging.service;

import com.example.messaging.config.MessagingProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final MessagingProperties properties;

    public RedisKeyFactory(MessagingProperties properties) {
        this.properties = properties;
    }

    private String prefix() {
        return properties.getRedis().getKeyPrefix();
    }

    public String conversationLockKey(String conversationId) {
        return "%s:conversation:%s:lock".formatted(prefix(), conversationId);
    }

    public String participantSetLockKey(String participantKey) {
        return "%s:participants:%s:lock".formatted(prefix(), participantKey);
    }

    public String digestDateKey() {
        return "%s:digest:last-date".formatted(prefix());
    }
}
