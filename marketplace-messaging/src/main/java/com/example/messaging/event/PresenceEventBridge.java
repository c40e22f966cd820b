package com.example.messaging.event;

import com.example.messaging.service.presence.PresenceListener;
import com.example.messaging.service.presence.PresenceTracker;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes online/offline transitions as lifecycle events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceEventBridge implements PresenceListener {

    private final PresenceTracker presenceTracker;
    private final ChatEventPublisher eventPublisher;
    private final Clock clock;

    @PostConstruct
    void register() {
        presenceTracker.addListener(this);
    }

    @Override
    public void userOnline(String userId) {
        log.info("User {} is online", userId);
        publish(ChatEventType.USER_ONLINE, userId);
    }

    @Override
    public void userOffline(String userId) {
        log.info("User {} is offline", userId);
        publish(ChatEventType.USER_OFFLINE, userId);
    }

    private void publish(ChatEventType type, String userId) {
        eventPublisher.publishLifecycleEvent(ChatEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .userId(userId)
                .occurredAt(clock.instant())
                .payload(Map.of())
                .build());
    }
}
