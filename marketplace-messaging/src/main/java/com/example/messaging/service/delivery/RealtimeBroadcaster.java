package com.example.messaging.service.delivery;

import com.example.messaging.domain.ChatMessage;
import com.example.messaging.service.presence.ConnectionHandle;
import com.example.messaging.service.presence.PresenceTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pushes events to every live connection of a user. A connection that fails a push is dropped from
 * presence and the remaining ones are still tried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeBroadcaster {

    public static final String NEW_MESSAGE_EVENT = "new_message";

    private final PresenceTracker presenceTracker;

    /**
     * @return {@code true} when at least one of the receiver's connections accepted the message
     */
    public boolean deliver(ChatMessage message) {
        return pushToUser(message.getReceiverId(), NEW_MESSAGE_EVENT, message) > 0;
    }

    /**
     * @return number of connections the event was handed to
     */
    public int pushToUser(String userId, String event, Object payload) {
        int delivered = 0;
        for (ConnectionHandle handle : presenceTracker.connections(userId)) {
            try {
                handle.push(event, payload);
                delivered++;
            } catch (RuntimeException ex) {
                log.warn("Dropping connection {} of user {} after failed {} push: {}", handle.id(), userId, event, ex.getMessage());
                presenceTracker.markOffline(userId, handle);
            }
        }
        return delivered;
    }
}
