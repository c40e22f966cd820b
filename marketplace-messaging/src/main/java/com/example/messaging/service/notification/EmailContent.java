package com.example.messaging.service.notification;

public record EmailContent(String subject, String html) {
}
