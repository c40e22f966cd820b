package com.example.messaging.service.notification;

import com.example.messaging.service.exception.NotificationSendException;

/**
 * Outbound email channel.
 */
public interface Notifier {

    /**
     * @throws NotificationSendException when the provider rejects or cannot be reached
     */
    void send(String to, String subject, String html);
}
