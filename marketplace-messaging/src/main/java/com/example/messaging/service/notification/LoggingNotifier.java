package com.example.messaging.service.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Used when no mail server is configured. Emails are logged and count as sent.
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void send(String to, String subject, String html) {
        log.info("Email delivery not configured, would send \"{}\" to {}", subject, to);
    }
}
